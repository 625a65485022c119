package com.cliffc.texpr.node;

import com.cliffc.texpr.MalformedInputException;
import com.cliffc.texpr.type.Dtype;
import com.cliffc.texpr.type.ScalarType;
import com.cliffc.texpr.util.SB;

/** Memory read of {@code base[index]} per lane, for lanes whose mask is
 *  non-zero.  The base is an opaque buffer handle.  A Load is never constant,
 *  whatever its index. */
public class Load extends Expr {
  public final Var _base;
  public final Expr _index, _mask;
  private Load( ScalarType st, Var base, Expr index, Expr mask ) {
    super(Kind.LOAD,Dtype.make(st,index.lanes()));
    _base=base; _index=index; _mask=mask;
  }

  public static Load make( ScalarType st, Var base, Expr index, Expr mask ) {
    if( base.scalar() != ScalarType.HANDLE )
      throw new MalformedInputException("Load base must be a handle: "+base);
    if( !st.is_numeric() )
      throw new MalformedInputException("Load of "+st);
    if( !index.scalar().is_integral() )
      throw new MalformedInputException("Load index must be integral: "+index._dtype);
    if( mask.lanes() != index.lanes() )
      throw new MalformedInputException("Load mask has "+mask.lanes()+" lanes, index has "+index.lanes());
    return new Load(st,base,index,mask);
  }
  // Unmasked load
  public static Load make( ScalarType st, Var base, Expr index ) {
    Expr one = IntImm.con(1);
    return make(st,base,index,index.lanes()==1 ? one : Broadcast.make(one,index.lanes()));
  }

  @Override public boolean is_con() { return false; }
  @Override public int len() { return 3; }
  @Override public Expr in( int i ) {
    return switch( i ) {
    case 0 -> _base;
    case 1 -> _index;
    case 2 -> _mask;
    default -> super.in(i);
    };
  }

  // All lanes enabled by a constant 1 mask
  private boolean unmasked() {
    Expr m = _mask instanceof Broadcast b ? b._value : _mask;
    return m instanceof IntImm ii && ii._con==1;
  }

  @Override public SB str( SB sb ) {
    _base.str(sb);
    if( scalar()!=ScalarType.FLOAT ) sb.p(':').p(scalar()._name);
    _index.str(sb.p('['));
    if( !unmasked() ) _mask.str(sb.p(", "));
    return sb.p(']');
  }
}
