package com.cliffc.texpr.node;

import com.cliffc.texpr.MalformedInputException;
import com.cliffc.texpr.type.Dtype;
import com.cliffc.texpr.type.ScalarType;
import com.cliffc.texpr.util.SB;

/** Call of a math intrinsic.  Parameters are promoted against each other and
 *  computed in floating point: integer parameters are cast to float.  The
 *  result has the parameter dtype, except {@code isnan} which gives int32.
 *  Every intrinsic is pure except {@code rand}. */
public class Intrinsics extends Expr {
  public enum Op {
    SIN("sin"), COS("cos"), TAN("tan"), ASIN("asin"), ACOS("acos"), ATAN("atan"), ATAN2("atan2",2),
    SINH("sinh"), COSH("cosh"), TANH("tanh"), SIGMOID("sigmoid"),
    EXP("exp"), EXPM1("expm1"), ABS("abs"),
    LOG("log"), LOG2("log2"), LOG10("log10"), LOG1P("log1p"),
    SQRT("sqrt"), RSQRT("rsqrt"), POW("pow",2),
    CEIL("ceil"), FLOOR("floor"), ROUND("round"), TRUNC("trunc"),
    FMOD("fmod",2), REMAINDER("remainder",2), FRAC("frac"), ISNAN("isnan"),
    RAND("rand",0);

    public final String _name;
    public final int _nargs;
    Op( String name ) { this(name,1); }
    Op( String name, int nargs ) { _name=name; _nargs=nargs; }
    // Random numbers have hidden state; everything else is a pure function
    public boolean is_pure() { return this!=RAND; }
    public static Op valueOfName( String name ) {
      for( Op op : values() )
        if( op._name.equals(name) )
          return op;
      return null;
    }
  }

  public final Op _op;
  private final Expr[] _params;
  private Intrinsics( Op op, Dtype dt, Expr[] params ) { super(Kind.INTRINSICS,dt); _op=op; _params=params; }

  public static Intrinsics make( Op op, Expr... params ) {
    if( params.length != op._nargs )
      throw new MalformedInputException(op._name+" takes "+op._nargs+" arguments, not "+params.length);
    if( op==Op.RAND ) return rand(Dtype.FLOAT);
    Dtype dt = params[0]._dtype;
    for( Expr p : params ) dt = Dtype.promote(dt,p._dtype);
    if( !dt._scalar.is_numeric() )
      throw new MalformedInputException(op._name+" of a "+dt);
    ScalarType st = dt._scalar.is_floating() ? dt._scalar : ScalarType.FLOAT;
    Expr[] ps = new Expr[params.length];
    for( int i=0; i<ps.length; i++ )
      ps[i] = Cast.make_if_needed(st,params[i]);
    return new Intrinsics(op,dt.with_scalar(op==Op.ISNAN ? ScalarType.INT : st),ps);
  }

  public static Intrinsics rand( Dtype dt ) {
    if( !dt._scalar.is_floating() )
      throw new MalformedInputException("rand of a "+dt);
    return new Intrinsics(Op.RAND,dt,new Expr[0]);
  }

  // Same call and dtype over new parameters
  public Intrinsics copy( Expr[] params ) {
    assert params.length==_params.length;
    for( int i=0; i<params.length; i++ ) assert params[i]._dtype==_params[i]._dtype;
    return new Intrinsics(_op,_dtype,params.clone());
  }

  public boolean is_pure() { return _op.is_pure(); }
  public int nparams() { return _params.length; }
  public Expr param( int i ) { return _params[i]; }

  @Override public boolean is_con() {
    if( !is_pure() ) return false;
    for( Expr p : _params )
      if( !p.is_con() )
        return false;
    return true;
  }
  @Override public int len() { return _params.length; }
  @Override public Expr in( int i ) { return i < _params.length ? _params[i] : super.in(i); }

  @Override boolean eq0( Expr e ) { return _op==((Intrinsics)e)._op; }
  @Override int hash0() { return _op.ordinal(); }

  @Override public SB str( SB sb ) {
    sb.p(_op._name).p('(');
    for( Expr p : _params ) p.str(sb).p(", ");
    if( _params.length > 0 ) sb.unchar(2);
    return sb.p(')');
  }
}
