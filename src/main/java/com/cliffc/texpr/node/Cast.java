package com.cliffc.texpr.node;

import com.cliffc.texpr.MalformedInputException;
import com.cliffc.texpr.type.ScalarType;
import com.cliffc.texpr.util.SB;

// Convert a value to another element type, keeping the lane count.
public class Cast extends Expr {
  public final Expr _src;
  private Cast( ScalarType st, Expr src ) { super(Kind.CAST,src._dtype.with_scalar(st)); _src=src; }

  public static Cast make( ScalarType st, Expr src ) {
    if( !st.is_numeric() || !src.scalar().is_numeric() )
      throw new MalformedInputException("Cannot cast "+src._dtype+" to "+st);
    return new Cast(st,src);
  }
  // Cast only if the element type differs
  public static Expr make_if_needed( ScalarType st, Expr src ) {
    return src.scalar()==st ? src : make(st,src);
  }

  @Override public boolean is_con() { return _src.is_con(); }
  @Override public int len() { return 1; }
  @Override public Expr in( int i ) { return i==0 ? _src : super.in(i); }

  @Override public SB str( SB sb ) { return _src.str(sb.p(scalar()._name).p('(')).p(')'); }
}
