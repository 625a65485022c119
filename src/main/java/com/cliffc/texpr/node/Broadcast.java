package com.cliffc.texpr.node;

import com.cliffc.texpr.MalformedInputException;
import com.cliffc.texpr.util.SB;

// A scalar replicated across all lanes of a vector.
public class Broadcast extends Expr {
  public final Expr _value;
  private Broadcast( Expr value, int lanes ) { super(Kind.BROADCAST,value._dtype.with_lanes(lanes)); _value=value; }

  public static Broadcast make( Expr value, int lanes ) {
    if( !value._dtype.is_scalar() )
      throw new MalformedInputException("Broadcast of a vector: "+value);
    return new Broadcast(value,lanes);
  }

  @Override public boolean is_con() { return _value.is_con(); }
  @Override public int len() { return 1; }
  @Override public Expr in( int i ) { return i==0 ? _value : super.in(i); }

  @Override public SB str( SB sb ) { return _value.str(sb.p("Broadcast(")).p(", ").p(lanes()).p(')'); }
}
