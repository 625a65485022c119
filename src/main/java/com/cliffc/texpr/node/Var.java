package com.cliffc.texpr.node;

import com.cliffc.texpr.type.Dtype;
import com.cliffc.texpr.util.SB;

// A free variable.  Never constant.  Two Vars are the same variable only if
// they are the same object; names are just for printing.  Prints as
// name:dtype unless int32, or a buffer handle.
public class Var extends Expr {
  public final String _name;
  private Var( String name, Dtype dt ) { super(Kind.VAR,dt); _name=name; }
  public static Var make( String name, Dtype dt ) { return new Var(name,dt); }
  // Buffer base pointer, for Loads
  public static Var handle( String name ) { return new Var(name,Dtype.HANDLE); }

  @Override public boolean is_con() { return false; }

  @Override boolean eq0( Expr e ) { return false; } // Only equal by identity
  @Override int hash0() { return _name.hashCode(); }

  @Override public SB str( SB sb ) {
    sb.p(_name);
    return _dtype==Dtype.INT || _dtype==Dtype.HANDLE ? sb : sb.p(':').p(_dtype);
  }
}
