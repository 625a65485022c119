package com.cliffc.texpr.util;

import com.cliffc.texpr.type.Dtype;

/** Tight/tiny StringBuilder wrapper, with the short names kept short so they
 *  do not obscure the printing code. */
public final class SB {
  public final StringBuilder _sb;
  int _indent = 0;
  public SB(        ) { _sb = new StringBuilder( ); }
  public SB(String s) { _sb = new StringBuilder(s); }
  public SB p( String s ) { _sb.append(s); return this; }
  public SB p( char   c ) { _sb.append(c); return this; }
  public SB p( int    i ) { _sb.append(i); return this; }
  public SB p( long   l ) { _sb.append(l); return this; }
  public SB p( Dtype dt ) { return dt.str(this); }
  // Doubles print so the expression parser can read them back
  public SB p( double d ) {
    if( Double.isNaN(d) ) return p("nan");
    if( Double.isInfinite(d) ) return p(d > 0 ? "inf" : "-inf");
    _sb.append(d);
    return this;
  }
  // Indent by the current depth
  public SB i() { for( int i=0; i<_indent; i++ ) _sb.append("  "); return this; }
  public SB ii( int d ) { _indent += d; return this; }
  public SB di( int d ) { _indent -= d; return this; }
  public SB nl() { return p('\n'); }
  // Remove the last n chars, e.g. a trailing ", "
  public SB unchar( int n ) { _sb.setLength(_sb.length()-n); return this; }
  public int len() { return _sb.length(); }
  @Override public String toString() { return _sb.toString(); }
}
