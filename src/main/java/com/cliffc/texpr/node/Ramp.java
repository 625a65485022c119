package com.cliffc.texpr.node;

import com.cliffc.texpr.MalformedInputException;
import com.cliffc.texpr.util.SB;

// A vector whose lane i is base + i*stride.
public class Ramp extends Expr {
  public final Expr _base, _stride;
  private Ramp( Expr base, Expr stride, int lanes ) {
    super(Kind.RAMP,base._dtype.with_lanes(lanes));
    _base = base;
    _stride = stride;
  }

  public static Ramp make( Expr base, Expr stride, int lanes ) {
    if( !base._dtype.is_scalar() || !stride._dtype.is_scalar() )
      throw new MalformedInputException("Ramp base and stride must be scalars");
    if( base._dtype != stride._dtype )
      throw new MalformedInputException("Ramp base "+base._dtype+" and stride "+stride._dtype+" differ");
    return new Ramp(base,stride,lanes);
  }

  @Override public boolean is_con() { return _base.is_con() && _stride.is_con(); }
  @Override public int len() { return 2; }
  @Override public Expr in( int i ) { return i==0 ? _base : (i==1 ? _stride : super.in(i)); }

  @Override public SB str( SB sb ) {
    _base.str(sb.p("Ramp("));
    return _stride.str(sb.p(", ")).p(", ").p(lanes()).p(')');
  }
}
