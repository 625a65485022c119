package com.cliffc.texpr.node;

import com.cliffc.texpr.type.Dtype;
import com.cliffc.texpr.type.ScalarType;
import com.cliffc.texpr.util.SB;
import com.cliffc.texpr.util.Util;

import java.util.function.Consumer;

/** An immutable node of the tensor expression tree.
 *  <p>
 *  Nodes never change after construction; rewriting always builds a new node
 *  or hands back an existing one, so subtrees can be freely shared.  Equality
 *  is structural, except that variables are only equal to themselves. */
public abstract class Expr {
  public final Kind _kind;
  public final Dtype _dtype;
  private int _hash;            // Lazy structural hash; 0 until computed

  Expr( Kind kind, Dtype dtype ) { _kind=kind; _dtype=dtype; }

  public Dtype dtype() { return _dtype; }
  public ScalarType scalar() { return _dtype._scalar; }
  public int lanes() { return _dtype._lanes; }

  // True for immediates, and for pure nodes whose inputs are all constant.
  public abstract boolean is_con();

  // Inputs, in a fixed order per variant
  public int len() { return 0; }
  public Expr in( int i ) { throw new IndexOutOfBoundsException(""+i); }

  // Pre-order walk over this tree
  public final void walk( Consumer<Expr> f ) {
    f.accept(this);
    for( int i=0; i<len(); i++ )
      in(i).walk(f);
  }

  // Infix print, readable by Parse
  public abstract SB str( SB sb );
  @Override public final String toString() { return str(new SB()).toString(); }

  // Indented tree dump: one node per line with its dtype
  public final String dump() { return _dump(new SB()).toString(); }
  private SB _dump( SB sb ) {
    sb.i().p(_kind.name()).p(' ').p(_dtype);
    if( len()==0 ) str(sb.p(' '));
    sb.nl().ii(1);
    for( int i=0; i<len(); i++ )
      in(i)._dump(sb);
    return sb.di(1);
  }

  // Compare the non-input fields, with 'e' already known to be the same kind
  boolean eq0( Expr e ) { return true; }
  int hash0() { return 0; }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof Expr e) ) return false;
    if( _kind!=e._kind || _dtype!=e._dtype || len()!=e.len() ) return false;
    if( hashCode()!=e.hashCode() || !eq0(e) ) return false;
    for( int i=0; i<len(); i++ )
      if( !in(i).equals(e.in(i)) )
        return false;
    return true;
  }

  @Override public int hashCode() {
    if( _hash!=0 ) return _hash;
    int h = Util.mix_hash(_kind.ordinal(),_dtype.hashCode());
    h = Util.mix_hash(h,hash0());
    for( int i=0; i<len(); i++ )
      h = Util.mix_hash(h,in(i).hashCode());
    return (_hash = h==0 ? 1 : h);
  }
}
