package com.cliffc.texpr.node;

import com.cliffc.texpr.MalformedInputException;
import com.cliffc.texpr.type.Dtype;
import com.cliffc.texpr.type.ScalarType;
import com.cliffc.texpr.util.SB;
import com.cliffc.texpr.util.Util;
import org.jetbrains.annotations.NotNull;

// Half, float or double immediate, rounded to its precision.
public class FloatImm extends Expr {
  public final double _con;
  private FloatImm( Dtype dt, double con ) { super(Kind.FLOAT_IMM,dt); _con=con; }

  public static @NotNull FloatImm make( ScalarType st, double con ) {
    if( !st.is_floating() )
      throw new MalformedInputException("Not a float type: "+st);
    return new FloatImm(Dtype.make(st),st.round(con));
  }
  public static FloatImm con( float con ) { return make(ScalarType.FLOAT,con); }

  @Override public boolean is_con() { return true; }

  @Override boolean eq0( Expr e ) { return Util.eq(_con,((FloatImm)e)._con); }
  @Override int hash0() { return Double.hashCode(_con); }

  @Override public SB str( SB sb ) {
    sb.p(_con);
    return scalar()==ScalarType.FLOAT ? sb : sb.p(':').p(_dtype);
  }
}
