package com.cliffc.texpr.node;

import com.cliffc.texpr.MalformedInputException;
import com.cliffc.texpr.UnsupportedOperatorException;
import com.cliffc.texpr.type.Dtype;
import com.cliffc.texpr.util.SB;
import org.jetbrains.annotations.NotNull;

/** Binary operators.  Both operands always share the node's dtype; mixed
 *  operands are promoted with Casts when the node is made.
 *  <p>
 *  All construction goes through {@link #make}, which is also the factory the
 *  folder uses to rebuild a node around rewritten operands. */
public abstract class BinaryOp extends Expr {
  public final Expr _lhs, _rhs;
  BinaryOp( Kind kind, Expr lhs, Expr rhs ) {
    super(kind,lhs._dtype);
    assert lhs._dtype==rhs._dtype;
    _lhs = lhs;
    _rhs = rhs;
  }

  // Operator specific flag; only Max and Min have one
  public boolean option() { return false; }

  @Override public boolean is_con() { return _lhs.is_con() && _rhs.is_con(); }
  @Override public int len() { return 2; }
  @Override public Expr in( int i ) { return i==0 ? _lhs : (i==1 ? _rhs : super.in(i)); }

  @Override public SB str( SB sb ) {
    _lhs.str(sb.p('('));
    return _rhs.str(sb.p(' ').p(_kind._op).p(' ')).p(')');
  }

  // Make a binary operator of the given kind.  'option' is the NaN
  // propagation mode for Max and Min, and ignored otherwise.
  public static @NotNull BinaryOp make( Kind kind, Expr lhs, Expr rhs, boolean option ) {
    if( !kind.is_binary() ) throw new UnsupportedOperatorException(kind);
    Dtype dt = Dtype.promote(lhs._dtype,rhs._dtype);
    if( !dt._scalar.is_numeric() )
      throw new MalformedInputException("No arithmetic on "+dt);
    if( kind.is_bitwise() && dt._scalar.is_floating() )
      throw new MalformedInputException("Bitwise "+kind+" on "+dt);
    lhs = Cast.make_if_needed(dt._scalar,lhs);
    rhs = Cast.make_if_needed(dt._scalar,rhs);
    return switch( kind ) {
    case ADD    -> new Add   (lhs,rhs);
    case SUB    -> new Sub   (lhs,rhs);
    case MUL    -> new Mul   (lhs,rhs);
    case DIV    -> new Div   (lhs,rhs);
    case MOD    -> new Mod   (lhs,rhs);
    case AND    -> new And   (lhs,rhs);
    case OR     -> new Or    (lhs,rhs);
    case XOR    -> new Xor   (lhs,rhs);
    case LSHIFT -> new Lshift(lhs,rhs);
    case RSHIFT -> new Rshift(lhs,rhs);
    case MAX    -> new Max   (lhs,rhs,option);
    case MIN    -> new Min   (lhs,rhs,option);
    default     -> throw new UnsupportedOperatorException(kind);
    };
  }

  public static BinaryOp add( Expr l, Expr r ) { return make(Kind.ADD   ,l,r,false); }
  public static BinaryOp sub( Expr l, Expr r ) { return make(Kind.SUB   ,l,r,false); }
  public static BinaryOp mul( Expr l, Expr r ) { return make(Kind.MUL   ,l,r,false); }
  public static BinaryOp div( Expr l, Expr r ) { return make(Kind.DIV   ,l,r,false); }
  public static BinaryOp mod( Expr l, Expr r ) { return make(Kind.MOD   ,l,r,false); }
  public static BinaryOp and( Expr l, Expr r ) { return make(Kind.AND   ,l,r,false); }
  public static BinaryOp or ( Expr l, Expr r ) { return make(Kind.OR    ,l,r,false); }
  public static BinaryOp xor( Expr l, Expr r ) { return make(Kind.XOR   ,l,r,false); }
  public static BinaryOp shl( Expr l, Expr r ) { return make(Kind.LSHIFT,l,r,false); }
  public static BinaryOp shr( Expr l, Expr r ) { return make(Kind.RSHIFT,l,r,false); }
  public static BinaryOp max( Expr l, Expr r, boolean propagate_nans ) { return make(Kind.MAX,l,r,propagate_nans); }
  public static BinaryOp min( Expr l, Expr r, boolean propagate_nans ) { return make(Kind.MIN,l,r,propagate_nans); }

  public static final class Add    extends BinaryOp { Add   (Expr l, Expr r) { super(Kind.ADD   ,l,r); } }
  public static final class Sub    extends BinaryOp { Sub   (Expr l, Expr r) { super(Kind.SUB   ,l,r); } }
  public static final class Mul    extends BinaryOp { Mul   (Expr l, Expr r) { super(Kind.MUL   ,l,r); } }
  public static final class Div    extends BinaryOp { Div   (Expr l, Expr r) { super(Kind.DIV   ,l,r); } }
  public static final class Mod    extends BinaryOp { Mod   (Expr l, Expr r) { super(Kind.MOD   ,l,r); } }
  public static final class And    extends BinaryOp { And   (Expr l, Expr r) { super(Kind.AND   ,l,r); } }
  public static final class Or     extends BinaryOp { Or    (Expr l, Expr r) { super(Kind.OR    ,l,r); } }
  public static final class Xor    extends BinaryOp { Xor   (Expr l, Expr r) { super(Kind.XOR   ,l,r); } }
  public static final class Lshift extends BinaryOp { Lshift(Expr l, Expr r) { super(Kind.LSHIFT,l,r); } }
  public static final class Rshift extends BinaryOp { Rshift(Expr l, Expr r) { super(Kind.RSHIFT,l,r); } }

  // Max and Min carry a NaN mode: when propagating, a NaN on either side wins;
  // otherwise the non-NaN side wins.
  public abstract static class MinMax extends BinaryOp {
    public final boolean _propagate_nans;
    MinMax( Kind kind, Expr l, Expr r, boolean propagate_nans ) { super(kind,l,r); _propagate_nans = propagate_nans; }
    @Override public boolean option() { return _propagate_nans; }
    @Override boolean eq0( Expr e ) { return _propagate_nans==((MinMax)e)._propagate_nans; }
    @Override int hash0() { return _propagate_nans ? 1 : 0; }
    @Override public SB str( SB sb ) {
      _lhs.str(sb.p(_kind._op).p('('));
      return _rhs.str(sb.p(", ")).p(", ").p(_propagate_nans ? 1 : 0).p(')');
    }
  }
  public static final class Max extends MinMax { Max(Expr l, Expr r, boolean p) { super(Kind.MAX,l,r,p); } }
  public static final class Min extends MinMax { Min(Expr l, Expr r, boolean p) { super(Kind.MIN,l,r,p); } }
}
