package com.cliffc.texpr.node;

import com.cliffc.texpr.MalformedInputException;
import com.cliffc.texpr.type.Dtype;
import com.cliffc.texpr.type.ScalarType;
import com.cliffc.texpr.util.SB;
import org.jetbrains.annotations.NotNull;

// Integral or bool immediate.  The value is kept wrapped to its type.
public class IntImm extends Expr {
  public final long _con;
  private IntImm( Dtype dt, long con ) { super(Kind.INT_IMM,dt); _con=con; }

  public static @NotNull IntImm make( ScalarType st, long con ) {
    if( !st.is_integral() && !st.is_bool() )
      throw new MalformedInputException("Not an integer type: "+st);
    return new IntImm(Dtype.make(st),st.wrap(con));
  }
  // Plain int32 constant
  public static IntImm con( long con ) { return make(ScalarType.INT,con); }

  @Override public boolean is_con() { return true; }

  @Override boolean eq0( Expr e ) { return _con==((IntImm)e)._con; }
  @Override int hash0() { return Long.hashCode(_con); }

  @Override public SB str( SB sb ) {
    sb.p(_con);
    return scalar()==ScalarType.INT ? sb : sb.p(':').p(_dtype);
  }
}
