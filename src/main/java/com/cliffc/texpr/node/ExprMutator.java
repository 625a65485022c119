package com.cliffc.texpr.node;

import org.jetbrains.annotations.NotNull;

/** Bottom-up tree rewriting.
 *  <p>
 *  {@link #mutate(Expr)} dispatches on the node kind.  The default rule for
 *  every composite node rewrites its inputs and rebuilds the node only if an
 *  input came back as a different object; otherwise the original node is
 *  returned, so an unchanged tree costs no allocation.  Leaves come back
 *  unchanged.  Subclasses override the per-variant rules they care about.
 */
public abstract class ExprMutator {

  public @NotNull Expr mutate( Expr e ) {
    return switch( e._kind ) {
    case INT_IMM        -> mutate((IntImm       )e);
    case FLOAT_IMM      -> mutate((FloatImm     )e);
    case VAR            -> mutate((Var          )e);
    case BROADCAST      -> mutate((Broadcast    )e);
    case RAMP           -> mutate((Ramp         )e);
    case ADD, SUB, MUL, DIV, MOD, AND, OR, XOR, LSHIFT, RSHIFT, MAX, MIN
                        -> mutate((BinaryOp     )e);
    case COMPARE_SELECT -> mutate((CompareSelect)e);
    case CAST           -> mutate((Cast         )e);
    case INTRINSICS     -> mutate((Intrinsics   )e);
    case LOAD           -> mutate((Load         )e);
    };
  }

  protected Expr mutate( IntImm   e ) { return e; }
  protected Expr mutate( FloatImm e ) { return e; }
  protected Expr mutate( Var      e ) { return e; }

  protected Expr mutate( Broadcast e ) {
    Expr value = mutate(e._value);
    return value==e._value ? e : Broadcast.make(value,e.lanes());
  }

  protected Expr mutate( Ramp e ) {
    Expr base   = mutate(e._base  );
    Expr stride = mutate(e._stride);
    return base==e._base && stride==e._stride ? e : Ramp.make(base,stride,e.lanes());
  }

  protected Expr mutate( BinaryOp e ) {
    Expr lhs = mutate(e._lhs);
    Expr rhs = mutate(e._rhs);
    return lhs==e._lhs && rhs==e._rhs ? e : BinaryOp.make(e._kind,lhs,rhs,e.option());
  }

  protected Expr mutate( CompareSelect e ) {
    Expr lhs  = mutate(e._lhs );
    Expr rhs  = mutate(e._rhs );
    Expr ret1 = mutate(e._ret1);
    Expr ret2 = mutate(e._ret2);
    if( lhs==e._lhs && rhs==e._rhs && ret1==e._ret1 && ret2==e._ret2 ) return e;
    return CompareSelect.make(lhs,rhs,ret1,ret2,e._op);
  }

  protected Expr mutate( Cast e ) {
    Expr src = mutate(e._src);
    return src==e._src ? e : Cast.make(e.scalar(),src);
  }

  protected Expr mutate( Intrinsics e ) {
    Expr[] ps = new Expr[e.nparams()];
    boolean changed = false;
    for( int i=0; i<ps.length; i++ )
      changed |= (ps[i] = mutate(e.param(i))) != e.param(i);
    return changed ? e.copy(ps) : e;
  }

  // The base handle is opaque; only the index and mask are rewritten
  protected Expr mutate( Load e ) {
    Expr index = mutate(e._index);
    Expr mask  = mutate(e._mask );
    return index==e._index && mask==e._mask ? e : Load.make(e.scalar(),e._base,index,mask);
  }
}
