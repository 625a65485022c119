package com.cliffc.texpr.eval;

import com.cliffc.texpr.EvalException;
import com.cliffc.texpr.node.*;
import com.cliffc.texpr.type.Dtype;
import com.cliffc.texpr.type.ScalarType;

import java.util.Arrays;
import java.util.HashMap;
import java.util.concurrent.ThreadLocalRandom;

import static com.cliffc.texpr.TX.unimpl;

/** Reference interpreter for expression trees.
 *  <p>
 *  Arithmetic is C-like and performed at each node's precision: integers wrap
 *  around, float results round to float and half results round to half.
 *  Integer division or modulo by zero gives 0.  Shift counts are masked to
 *  the operand width.  Float to integer casts truncate toward zero.
 *  <p>
 *  Variables and load buffers must be bound before evaluating.
 */
public class ExprEval {
  private final HashMap<Var,Value> _vars = new HashMap<>();
  private final HashMap<Var,Value> _bufs = new HashMap<>();

  public ExprEval bind( Var v, Value val ) {
    if( v._dtype != val._dtype )
      throw new EvalException("Binding "+v._name+":"+v._dtype+" to a "+val._dtype);
    _vars.put(v,val);
    return this;
  }

  public ExprEval bind_buffer( Var buf, Value data ) {
    if( buf.scalar() != ScalarType.HANDLE )
      throw new EvalException("Not a buffer handle: "+buf._name);
    _bufs.put(buf,data);
    return this;
  }

  public Value eval( Expr e ) {
    return switch( e._kind ) {
    case INT_IMM   -> Value.make(e._dtype,((IntImm)e)._con);
    case FLOAT_IMM -> Value.make(e._dtype,((FloatImm)e)._con);
    case VAR       -> var((Var)e);
    case BROADCAST -> broadcast((Broadcast)e);
    case RAMP      -> ramp((Ramp)e);
    case ADD, SUB, MUL, DIV, MOD, AND, OR, XOR, LSHIFT, RSHIFT, MAX, MIN
                   -> binary((BinaryOp)e);
    case COMPARE_SELECT -> compare_select((CompareSelect)e);
    case CAST      -> cast((Cast)e);
    case INTRINSICS-> intrinsics((Intrinsics)e);
    case LOAD      -> load((Load)e);
    };
  }

  private Value var( Var v ) {
    Value val = _vars.get(v);
    if( val==null ) throw new EvalException("Unbound variable "+v._name);
    return val;
  }

  private Value broadcast( Broadcast b ) {
    Value v = eval(b._value);
    int lanes = b.lanes();
    if( v.is_floating() ) {
      double[] ds = new double[lanes];
      Arrays.fill(ds,v.getd(0));
      return Value.make(b._dtype,ds);
    }
    long[] ls = new long[lanes];
    Arrays.fill(ls,v.getl(0));
    return Value.make(b._dtype,ls);
  }

  private Value ramp( Ramp r ) {
    Value base = eval(r._base), stride = eval(r._stride);
    ScalarType st = r.scalar();
    int lanes = r.lanes();
    if( base.is_floating() ) {
      double[] ds = new double[lanes];
      for( int i=0; i<lanes; i++ )
        ds[i] = base.getd(0) + st.round(i*stride.getd(0));
      return Value.make(r._dtype,ds);
    }
    long[] ls = new long[lanes];
    for( int i=0; i<lanes; i++ )
      ls[i] = base.getl(0) + i*stride.getl(0);
    return Value.make(r._dtype,ls);
  }

  private Value binary( BinaryOp op ) {
    Value l = eval(op._lhs), r = eval(op._rhs);
    ScalarType st = op.scalar();
    int lanes = op.lanes();
    if( l.is_floating() ) {
      double[] ds = new double[lanes];
      for( int i=0; i<lanes; i++ )
        ds[i] = fop(op._kind,op.option(),l.getd(i),r.getd(i));
      return Value.make(op._dtype,ds);
    }
    long[] ls = new long[lanes];
    int mask = st==ScalarType.LONG ? 63 : 31;
    for( int i=0; i<lanes; i++ )
      ls[i] = iop(op._kind,mask,l.getl(i),r.getl(i));
    return Value.make(op._dtype,ls);
  }

  // Integer ops on wrapped payloads; the caller wraps the result
  static long iop( Kind kind, int shift_mask, long a, long b ) {
    return switch( kind ) {
    case ADD    -> a + b;
    case SUB    -> a - b;
    case MUL    -> a * b;
    case DIV    -> b==0 ? 0 : a / b;
    case MOD    -> b==0 ? 0 : a % b;
    case AND    -> a & b;
    case OR     -> a | b;
    case XOR    -> a ^ b;
    case LSHIFT -> a << (b & shift_mask);
    case RSHIFT -> a >> (b & shift_mask);
    case MAX    -> Math.max(a,b);
    case MIN    -> Math.min(a,b);
    default     -> throw unimpl("integer "+kind);
    };
  }

  // Float ops; the caller rounds the result to the node precision
  static double fop( Kind kind, boolean propagate_nans, double a, double b ) {
    return switch( kind ) {
    case ADD -> a + b;
    case SUB -> a - b;
    case MUL -> a * b;
    case DIV -> a / b;
    case MOD -> a % b;          // C fmod
    case MAX -> Double.isNaN(a) ? (propagate_nans ? a : b) : (Double.isNaN(b) ? (propagate_nans ? b : a) : (a < b ? b : a));
    case MIN -> Double.isNaN(a) ? (propagate_nans ? a : b) : (Double.isNaN(b) ? (propagate_nans ? b : a) : (a > b ? b : a));
    default  -> throw unimpl("float "+kind);
    };
  }

  private Value compare_select( CompareSelect cs ) {
    Value l = eval(cs._lhs), r = eval(cs._rhs);
    Value t = eval(cs._ret1), f = eval(cs._ret2);
    int lanes = cs.lanes();
    boolean[] picks = new boolean[lanes];
    for( int i=0; i<lanes; i++ )
      picks[i] = l.is_floating()
        ? fcmp(cs._op,l.getd(i),r.getd(i))
        : cs._op.test(Long.compare(l.getl(i),r.getl(i))); // uint8 and bool payloads are never negative
    if( t.is_floating() ) {
      double[] ds = new double[lanes];
      for( int i=0; i<lanes; i++ ) ds[i] = picks[i] ? t.getd(i) : f.getd(i);
      return Value.make(cs._dtype,ds);
    }
    long[] ls = new long[lanes];
    for( int i=0; i<lanes; i++ ) ls[i] = picks[i] ? t.getl(i) : f.getl(i);
    return Value.make(cs._dtype,ls);
  }
  // IEEE compare: every ordered test fails on NaN, and != succeeds
  private static boolean fcmp( CompareSelect.Op op, double a, double b ) {
    return switch( op ) {
    case EQ -> a == b;
    case NE -> a != b;
    case GT -> a >  b;
    case GE -> a >= b;
    case LT -> a <  b;
    case LE -> a <= b;
    };
  }

  private Value cast( Cast c ) {
    Value v = eval(c._src);
    ScalarType to = c.scalar();
    int lanes = c.lanes();
    if( to.is_floating() ) {
      double[] ds = new double[lanes];
      for( int i=0; i<lanes; i++ )
        ds[i] = v.is_floating() ? v.getd(i) : i2f(to,v.getl(i));
      return Value.make(c._dtype,ds);
    }
    long[] ls = new long[lanes];
    for( int i=0; i<lanes; i++ )
      ls[i] = v.is_floating() ? f2i(to,v.getd(i)) : v.getl(i);
    return Value.make(c._dtype,ls);
  }
  // Integer to float, rounding once from the exact integer
  private static double i2f( ScalarType to, long l ) {
    return to==ScalarType.DOUBLE ? (double)l : (float)l;
  }
  // Float to integer: truncate toward zero, NaN gives 0.  Bool is a plain non-zero test.
  private static long f2i( ScalarType to, double d ) {
    return to==ScalarType.BOOL ? (d != 0 ? 1 : 0) : (long)d;
  }

  private Value intrinsics( Intrinsics call ) {
    Value[] ps = new Value[call.nparams()];
    for( int i=0; i<ps.length; i++ ) ps[i] = eval(call.param(i));
    int lanes = call.lanes();
    double[] ds = new double[lanes];
    for( int i=0; i<lanes; i++ )
      ds[i] = intrinsic(call._op,
                        ps.length > 0 ? ps[0].getd(i) : 0,
                        ps.length > 1 ? ps[1].getd(i) : 0);
    if( call.scalar().is_floating() ) return Value.make(call._dtype,ds);
    long[] ls = new long[lanes];
    for( int i=0; i<lanes; i++ ) ls[i] = (long)ds[i];
    return Value.make(call._dtype,ls);
  }

  static double intrinsic( Intrinsics.Op op, double a, double b ) {
    return switch( op ) {
    case SIN       -> Math.sin(a);
    case COS       -> Math.cos(a);
    case TAN       -> Math.tan(a);
    case ASIN      -> Math.asin(a);
    case ACOS      -> Math.acos(a);
    case ATAN      -> Math.atan(a);
    case ATAN2     -> Math.atan2(a,b);
    case SINH      -> Math.sinh(a);
    case COSH      -> Math.cosh(a);
    case TANH      -> Math.tanh(a);
    case SIGMOID   -> 1.0/(1.0+Math.exp(-a));
    case EXP       -> Math.exp(a);
    case EXPM1     -> Math.expm1(a);
    case ABS       -> Math.abs(a);
    case LOG       -> Math.log(a);
    case LOG2      -> Math.log(a)/Math.log(2.0);
    case LOG10     -> Math.log10(a);
    case LOG1P     -> Math.log1p(a);
    case SQRT      -> Math.sqrt(a);
    case RSQRT     -> 1.0/Math.sqrt(a);
    case POW       -> Math.pow(a,b);
    case CEIL      -> Math.ceil(a);
    case FLOOR     -> Math.floor(a);
    case ROUND     -> Math.rint(a); // Ties to even, like nearbyint
    case TRUNC     -> a < 0 ? Math.ceil(a) : Math.floor(a);
    case FMOD      -> a % b;
    case REMAINDER -> Math.IEEEremainder(a,b);
    case FRAC      -> a - (a < 0 ? Math.ceil(a) : Math.floor(a));
    case ISNAN     -> Double.isNaN(a) ? 1 : 0;
    case RAND      -> ThreadLocalRandom.current().nextDouble();
    };
  }

  private Value load( Load ld ) {
    Value buf = _bufs.get(ld._base);
    if( buf==null ) throw new EvalException("Unbound buffer "+ld._base._name);
    if( buf._dtype._scalar != ld.scalar() )
      throw new EvalException("Loading "+ld.scalar()+" from a "+buf._dtype._scalar+" buffer "+ld._base._name);
    Value idx = eval(ld._index), mask = eval(ld._mask);
    int lanes = ld.lanes();
    long  [] ls = new long  [lanes];
    double[] ds = new double[lanes];
    for( int i=0; i<lanes; i++ ) {
      if( mask.is_floating() ? mask.getd(i)==0 : mask.getl(i)==0 ) continue; // Masked-off lanes read 0
      long x = idx.getl(i);
      if( x < 0 || x >= buf.lanes() )
        throw new EvalException("Load "+ld._base._name+"["+x+"] out of bounds of "+buf.lanes());
      if( buf.is_floating() ) ds[i] = buf.getd((int)x);
      else                    ls[i] = buf.getl((int)x);
    }
    Dtype dt = ld._dtype;
    return buf.is_floating() ? Value.make(dt,ds) : Value.make(dt,ls);
  }
}
