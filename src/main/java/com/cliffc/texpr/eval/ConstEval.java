package com.cliffc.texpr.eval;

import com.cliffc.texpr.UnsupportedDtypeException;
import com.cliffc.texpr.node.*;
import com.cliffc.texpr.type.ScalarType;
import com.cliffc.texpr.util.Util;
import org.jetbrains.annotations.NotNull;

/** Collapses a constant expression into immediates.
 *  <p>
 *  The node is run through {@link ExprEval} and the result rebuilt at the
 *  node's dtype: a scalar becomes an {@link IntImm} or {@link FloatImm}, a
 *  vector with all lanes equal becomes a {@link Broadcast} of one, and a
 *  vector whose lanes step evenly becomes a {@link Ramp}.  Any other vector
 *  has no immediate form, and the node comes back unchanged.
 */
public class ConstEval {

  public @NotNull Expr evaluate( Expr e ) {
    ScalarType st = e.scalar();
    if( !supported(st) ) throw new UnsupportedDtypeException(e._dtype);
    assert e.is_con() : "Not a constant: "+e;
    return materialize(e,new ExprEval().eval(e));
  }

  private static boolean supported( ScalarType st ) {
    return switch( st ) {
    case BYTE, CHAR, SHORT, INT, LONG, BOOL -> true;
    case HALF, FLOAT, DOUBLE -> true;
    case HANDLE -> false;
    };
  }

  private static Expr imm( ScalarType st, Value v, int lane ) {
    return v.is_floating() ? FloatImm.make(st,v.getd(lane)) : IntImm.make(st,v.getl(lane));
  }

  static Expr materialize( Expr e, Value v ) {
    ScalarType st = e.scalar();
    Expr lane0 = imm(st,v,0);
    int lanes = v.lanes();
    if( lanes==1 ) return lane0;
    if( splat(v) ) return Broadcast.make(lane0,lanes);
    Expr stride = v.is_floating()
      ? FloatImm.make(st,v.getd(1)-v.getd(0))
      : IntImm  .make(st,v.getl(1)-v.getl(0));
    Ramp ramp = Ramp.make(lane0,stride,lanes);
    // Only keep the ramp if it reproduces every lane exactly
    return new ExprEval().eval(ramp).equals(v) ? ramp : e;
  }

  // All lanes equal, bitwise for floats
  private static boolean splat( Value v ) {
    for( int i=1; i<v.lanes(); i++ )
      if( v.is_floating() ? !Util.eq(v.getd(i),v.getd(0)) : v.getl(i)!=v.getl(0) )
        return false;
    return true;
  }
}
