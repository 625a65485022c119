package com.cliffc.texpr.node;

import com.cliffc.texpr.MalformedInputException;
import com.cliffc.texpr.type.Dtype;
import com.cliffc.texpr.util.SB;

/** Lane-wise {@code lhs op rhs ? ret1 : ret2}.  The comparison operands are
 *  promoted against each other, and so are the two results; the node has the
 *  result dtype.  All four inputs are always evaluated. */
public class CompareSelect extends Expr {
  public enum Op {
    EQ("=="), NE("!="), GT(">"), GE(">="), LT("<"), LE("<=");
    public final String _str;
    Op( String str ) { _str=str; }
    public boolean test( int cmp ) {
      return switch( this ) {
      case EQ -> cmp == 0;
      case NE -> cmp != 0;
      case GT -> cmp >  0;
      case GE -> cmp >= 0;
      case LT -> cmp <  0;
      case LE -> cmp <= 0;
      };
    }
  }

  public final Expr _lhs, _rhs, _ret1, _ret2;
  public final Op _op;
  private CompareSelect( Expr lhs, Expr rhs, Expr ret1, Expr ret2, Op op ) {
    super(Kind.COMPARE_SELECT,ret1._dtype);
    _lhs=lhs; _rhs=rhs; _ret1=ret1; _ret2=ret2; _op=op;
  }

  public static CompareSelect make( Expr lhs, Expr rhs, Expr ret1, Expr ret2, Op op ) {
    Dtype cmp = Dtype.promote(lhs._dtype,rhs._dtype);
    Dtype ret = Dtype.promote(ret1._dtype,ret2._dtype);
    if( !cmp._scalar.is_numeric() || !ret._scalar.is_numeric() )
      throw new MalformedInputException("CompareSelect over a handle");
    if( cmp._lanes != ret._lanes )
      throw new MalformedInputException("Lane mismatch: "+cmp+" compared, "+ret+" selected");
    return new CompareSelect(Cast.make_if_needed(cmp._scalar,lhs ),
                             Cast.make_if_needed(cmp._scalar,rhs ),
                             Cast.make_if_needed(ret._scalar,ret1),
                             Cast.make_if_needed(ret._scalar,ret2),op);
  }
  // Plain comparison: int32 1 or 0 per lane
  public static CompareSelect make( Expr lhs, Expr rhs, Op op ) {
    int lanes = lhs.lanes();
    Expr one = IntImm.con(1), zero = IntImm.con(0);
    if( lanes > 1 ) { one = Broadcast.make(one,lanes); zero = Broadcast.make(zero,lanes); }
    return make(lhs,rhs,one,zero,op);
  }

  @Override public boolean is_con() { return _lhs.is_con() && _rhs.is_con() && _ret1.is_con() && _ret2.is_con(); }
  @Override public int len() { return 4; }
  @Override public Expr in( int i ) {
    return switch( i ) {
    case 0 -> _lhs;
    case 1 -> _rhs;
    case 2 -> _ret1;
    case 3 -> _ret2;
    default -> super.in(i);
    };
  }

  @Override boolean eq0( Expr e ) { return _op==((CompareSelect)e)._op; }
  @Override int hash0() { return _op.ordinal(); }

  @Override public SB str( SB sb ) {
    _lhs.str(sb.p('('));
    _rhs.str(sb.p(' ').p(_op._str).p(' '));
    _ret1.str(sb.p(" ? "));
    return _ret2.str(sb.p(" : ")).p(')');
  }
}
