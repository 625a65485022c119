package com.cliffc.texpr.pass;

import com.cliffc.texpr.eval.ConstEval;
import com.cliffc.texpr.node.*;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Constant folding and algebraic simplification.
 *  <p>
 *  One bottom-up pass: the inputs of each node are folded first (left before
 *  right), then the node's own rules apply.  Binary operators check a few
 *  identities on immediates (x+0, x-0, x*1, x/1 and a Broadcast offset added
 *  to a Ramp), then rebuild around changed inputs and evaluate when both
 *  inputs are constant.  Casts, selects and pure intrinsics evaluate when
 *  their inputs are constant.  Loads are never evaluated and their base
 *  handle is never touched.  Unchanged subtrees come back as the same object.
 *  <p>
 *  A folder keeps per-run counters and is not meant to be shared across
 *  threads; {@link #simplify} makes a fresh one per call.
 */
public class ConstantFolder extends ExprMutator {
  private static final Logger LOG = LoggerFactory.getLogger(ConstantFolder.class);

  private final ConstEval _eval;
  int _nevals;                  // Constant evaluations this run
  int _nidents;                 // Identity rewrites this run

  public ConstantFolder() { this(new ConstEval()); }
  public ConstantFolder( ConstEval eval ) { _eval = eval; }

  public static @NotNull Expr simplify( Expr e ) { return new ConstantFolder().fold(e); }

  public @NotNull Expr fold( Expr e ) {
    _nevals = _nidents = 0;
    Expr f = mutate(e);
    LOG.trace("{} evaluations, {} identities: {} => {}",_nevals,_nidents,e,f);
    return f;
  }

  @Override protected Expr mutate( BinaryOp e ) {
    Expr l = mutate(e._lhs);
    Expr r = mutate(e._rhs);
    Expr x = identity(e._kind,l,r);
    if( x!=null ) { _nidents++; return x; }
    return fold_binary(e,l,r);
  }

  // Rewrite for an identity over folded inputs, or null
  private Expr identity( Kind kind, Expr l, Expr r ) {
    return switch( kind ) {
    case ADD -> add_identity(l,r);
    case SUB -> is_int(r,0) ? l : null;
    case MUL -> mul_identity(l,r);
    case DIV -> is_int(r,1) ? l : null;
    default  -> null;
    };
  }

  private Expr add_identity( Expr l, Expr r ) {
    if( is_int(l,0) || is_splat(l,0) ) return r;
    if( is_int(r,0) || is_splat(r,0) ) return l;
    if( l instanceof Broadcast b && r instanceof Ramp ramp ) return ramp_offset(b,ramp);
    if( r instanceof Broadcast b && l instanceof Ramp ramp ) return ramp_offset(b,ramp);
    return null;
  }

  // Broadcast(b) + Ramp(base,stride) is Ramp(b+base,stride); the new base may fold further
  private Expr ramp_offset( Broadcast b, Ramp r ) {
    return mutate(Ramp.make(BinaryOp.add(b._value,r._base),r._stride,r.lanes()));
  }

  private Expr mul_identity( Expr l, Expr r ) {
    if( is_int(l,1) || is_one(l) || is_splat(l,1) ) return r;
    if( is_int(r,1) || is_one(r) || is_splat(r,1) ) return l;
    return null;
  }

  private static boolean is_int( Expr e, long con ) { return e instanceof IntImm ii && ii._con==con; }
  private static boolean is_one( Expr e ) { return e instanceof FloatImm f && f._con==1.0; }
  private static boolean is_splat( Expr e, long con ) { return e instanceof Broadcast b && is_int(b._value,con); }

  // Reuse the node if its inputs did not change, else rebuild; evaluate if constant
  private Expr fold_binary( BinaryOp e, Expr l, Expr r ) {
    Expr node = l==e._lhs && r==e._rhs ? e : BinaryOp.make(e._kind,l,r,e.option());
    return l.is_con() && r.is_con() ? evaluate(node) : node;
  }

  @Override protected Expr mutate( Cast e ) {
    Expr node = super.mutate(e);
    return node.is_con() ? evaluate(node) : node;
  }

  @Override protected Expr mutate( CompareSelect e ) {
    Expr node = super.mutate(e);
    return node.is_con() ? evaluate(node) : node;
  }

  @Override protected Expr mutate( Intrinsics e ) {
    Expr[] ps = new Expr[e.nparams()];
    boolean changed = false, all_con = true;
    for( int i=0; i<ps.length; i++ ) {
      ps[i] = mutate(e.param(i));
      changed |= ps[i]!=e.param(i);
      all_con &= ps[i].is_con();
    }
    Intrinsics node = changed ? e.copy(ps) : e;
    return all_con && node.is_pure() ? evaluate(node) : node;
  }

  private Expr evaluate( Expr node ) {
    Expr x = _eval.evaluate(node);
    _nevals++;
    LOG.debug("{} => {}",node,x);
    return x;
  }
}
