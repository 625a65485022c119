package com.cliffc.texpr.pass;

import com.cliffc.texpr.UnsupportedDtypeException;
import com.cliffc.texpr.eval.ConstEval;
import com.cliffc.texpr.eval.ExprEval;
import com.cliffc.texpr.eval.Value;
import com.cliffc.texpr.node.*;
import com.cliffc.texpr.type.Dtype;
import com.cliffc.texpr.type.ScalarType;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.Assert.*;

public class TestConstantFolder {
  private static final Var X = Var.make("x",Dtype.INT);
  private static final Var Y = Var.make("y",Dtype.INT);
  private static final Var L = Var.make("l",Dtype.LONG);
  private static final Var F = Var.make("f",Dtype.FLOAT);
  private static final Var I = Var.make("i",Dtype.INT);
  private static final Var A = Var.handle("A");

  private static IntImm con( long l ) { return IntImm.con(l); }
  private static FloatImm fcon( float f ) { return FloatImm.con(f); }
  private static Expr fold( Expr e ) { return ConstantFolder.simplify(e); }

  @Test public void testAddIdentity() {
    assertSame(X,fold(BinaryOp.add(con(0),X)));
    assertSame(X,fold(BinaryOp.add(X,con(0))));
    // Any integral width
    assertSame(L,fold(BinaryOp.add(L,IntImm.make(ScalarType.LONG,0))));
    // int32 zero promotes to int64, folds to an int64 zero, then drops out
    assertSame(L,fold(BinaryOp.add(con(0),L)));
    // Zero only after folding
    assertSame(X,fold(BinaryOp.add(X,BinaryOp.sub(con(3),con(3)))));
    Ramp r = Ramp.make(X,con(1),4);
    assertSame(r,fold(BinaryOp.add(Broadcast.make(con(0),4),r)));
    assertSame(r,fold(BinaryOp.add(r,Broadcast.make(con(0),4))));
    // Float zero is not an identity
    Expr fz = BinaryOp.add(F,fcon(0f));
    assertSame(fz,fold(fz));
  }

  @Test public void testSubMulDivIdentity() {
    assertSame(X,fold(BinaryOp.sub(X,con(0))));
    assertSame(X,fold(BinaryOp.mul(con(1),X)));
    assertSame(X,fold(BinaryOp.mul(X,con(1))));
    assertSame(F,fold(BinaryOp.mul(fcon(1f),F)));
    assertSame(F,fold(BinaryOp.mul(F,fcon(1f))));
    Var d = Var.make("d",Dtype.DOUBLE);
    assertSame(d,fold(BinaryOp.mul(d,FloatImm.make(ScalarType.DOUBLE,1))));
    Var v = Var.make("v",Dtype.make(ScalarType.INT,4));
    assertSame(v,fold(BinaryOp.mul(Broadcast.make(con(1),4),v)));
    assertSame(v,fold(BinaryOp.mul(v,Broadcast.make(con(1),4))));
    assertSame(X,fold(BinaryOp.div(X,con(1))));
    // One-sided rules
    Expr zx = BinaryOp.sub(con(0),X);
    assertSame(zx,fold(zx));
    Expr ox = BinaryOp.div(con(1),X);
    assertSame(ox,fold(ox));
    Expr mod = BinaryOp.mod(X,con(1));
    assertSame(mod,fold(mod));
  }

  @Test public void testBroadcastRamp() {
    Expr e = BinaryOp.add(Broadcast.make(con(5),4),Ramp.make(I,con(1),4));
    assertEquals(Ramp.make(BinaryOp.add(con(5),I),con(1),4),fold(e));
    Expr e2 = BinaryOp.add(Ramp.make(I,con(1),4),Broadcast.make(con(5),4));
    assertEquals(Ramp.make(BinaryOp.add(con(5),I),con(1),4),fold(e2));
    // The new base folds further
    Expr e3 = BinaryOp.add(Ramp.make(con(2),con(3),4),Broadcast.make(BinaryOp.mul(con(2),con(4)),4));
    assertEquals(Ramp.make(con(10),con(3),4),fold(e3));
    Expr e4 = BinaryOp.add(Broadcast.make(X,4),Ramp.make(con(0),con(1),4));
    assertEquals(Ramp.make(X,con(1),4),fold(e4));
  }

  @Test public void testCollapse() {
    assertEquals(con(30),fold(BinaryOp.mul(BinaryOp.add(con(2),con(3)),BinaryOp.sub(con(10),con(4)))));
    assertEquals(fcon(2f),fold(Intrinsics.make(Intrinsics.Op.SQRT,BinaryOp.add(fcon(2f),fcon(2f)))));
    assertEquals(con(2),fold(Cast.make(ScalarType.INT,fcon(2.7f))));
    assertEquals(con(1),fold(CompareSelect.make(con(1),con(2),CompareSelect.Op.LT)));
    assertEquals(fcon(2.5f),fold(CompareSelect.make(con(3),con(2),fcon(1.5f),fcon(2.5f),CompareSelect.Op.LE)));
    assertEquals(con(3),fold(BinaryOp.xor(BinaryOp.shl(con(1),con(3)),con(11))));
    assertEquals(Broadcast.make(con(7),4),fold(BinaryOp.add(Broadcast.make(con(3),4),Broadcast.make(con(4),4))));
    assertEquals(IntImm.make(ScalarType.LONG,-1),fold(BinaryOp.sub(con(1),IntImm.make(ScalarType.LONG,2))));
  }

  @Test public void testPartialFold() {
    Expr e = BinaryOp.mul(X,BinaryOp.add(con(2),con(3)));
    assertEquals(BinaryOp.mul(X,con(5)),fold(e));
    Expr cs = CompareSelect.make(X,BinaryOp.add(con(1),con(2)),CompareSelect.Op.LT);
    assertEquals(CompareSelect.make(X,con(3),CompareSelect.Op.LT),fold(cs));
    Expr pow = Intrinsics.make(Intrinsics.Op.POW,F,BinaryOp.add(con(1),con(1)));
    assertEquals(Intrinsics.make(Intrinsics.Op.POW,F,fcon(2f)),fold(pow));
  }

  @Test public void testUnchanged() {
    Expr e = BinaryOp.add(X,BinaryOp.mul(Y,con(2)));
    assertSame(e,fold(e));
    Expr sin = Intrinsics.make(Intrinsics.Op.SIN,F);
    assertSame(sin,fold(sin));
    Expr cs = CompareSelect.make(X,Y,CompareSelect.Op.NE);
    assertSame(cs,fold(cs));
    Expr b = Broadcast.make(con(5),4);
    assertSame(b,fold(b));
  }

  @Test public void testCast() {
    // Casts rebuild around a rewritten source
    assertEquals(Cast.make(ScalarType.FLOAT,X),fold(Cast.make(ScalarType.FLOAT,BinaryOp.add(X,con(0)))));
    Expr c = Cast.make(ScalarType.LONG,X);
    assertSame(c,fold(c));
    assertEquals(FloatImm.make(ScalarType.DOUBLE,(double)0.1f),fold(Cast.make(ScalarType.DOUBLE,fcon(0.1f))));
  }

  @Test public void testLoad() {
    Load ld = Load.make(ScalarType.FLOAT,A,X);
    assertSame(ld,fold(ld));
    Load ld2 = (Load)fold(Load.make(ScalarType.FLOAT,A,BinaryOp.add(X,con(0))));
    assertSame(A,ld2._base);
    assertSame(X,ld2._index);
    // Never an immediate, even with a constant index
    Expr ld3 = fold(Load.make(ScalarType.INT,A,BinaryOp.add(con(1),con(2)),BinaryOp.mul(con(1),con(1))));
    assertEquals(Load.make(ScalarType.INT,A,con(3)),ld3);
    Expr sum = fold(BinaryOp.add(Load.make(ScalarType.FLOAT,A,con(0)),fcon(1f)));
    assertTrue(sum instanceof BinaryOp);
  }

  @Test public void testImpure() {
    Expr rand = Intrinsics.make(Intrinsics.Op.RAND);
    assertSame(rand,fold(rand));
    Expr sr = Intrinsics.make(Intrinsics.Op.SIN,rand);
    assertSame(sr,fold(sr));
    Expr sum = BinaryOp.add(rand,BinaryOp.mul(fcon(2f),fcon(3f)));
    assertEquals(BinaryOp.add(rand,fcon(6f)),fold(sum));
  }

  @Test public void testMinMax() {
    Expr mx = fold(BinaryOp.max(X,BinaryOp.add(con(1),con(2)),true));
    assertEquals(BinaryOp.max(X,con(3),true),mx);
    assertTrue(((BinaryOp.MinMax)mx)._propagate_nans);
    Expr mn = fold(BinaryOp.min(X,BinaryOp.add(con(1),con(2)),false));
    assertFalse(((BinaryOp.MinMax)mn)._propagate_nans);

    FloatImm nan = fcon(Float.NaN), one = fcon(1f);
    assertTrue(Double.isNaN(((FloatImm)fold(BinaryOp.max(nan,one,true )))._con));
    assertEquals(fcon(1f),fold(BinaryOp.max(nan,one,false)));
    assertTrue(Double.isNaN(((FloatImm)fold(BinaryOp.min(one,nan,true )))._con));
    assertEquals(fcon(1f),fold(BinaryOp.min(one,nan,false)));
  }

  // A failing evaluator is not caught by the folder
  @Test(expected = UnsupportedDtypeException.class)
  public void testFatal() {
    ConstEval broken = new ConstEval() {
      @Override public Expr evaluate( Expr e ) { throw new UnsupportedDtypeException(e.dtype()); }
    };
    new ConstantFolder(broken).fold(BinaryOp.add(X,BinaryOp.add(con(1),con(2))));
  }

  // The evaluator only ever sees constant nodes
  @Test public void testEvaluatesOnlyConstants() {
    List<Expr> seen = new ArrayList<>();
    ConstEval spy = new ConstEval() {
      @Override public Expr evaluate( Expr e ) { seen.add(e); return super.evaluate(e); }
    };
    ConstantFolder cf = new ConstantFolder(spy);
    Expr e = BinaryOp.add(BinaryOp.mul(X,BinaryOp.sub(con(7),con(2))),
                          Load.make(ScalarType.INT,A,BinaryOp.add(Y,con(0))));
    Expr f = cf.fold(e);
    assertEquals(BinaryOp.add(BinaryOp.mul(X,con(5)),Load.make(ScalarType.INT,A,Y)),f);
    assertEquals(1,seen.size());
    for( Expr s : seen ) assertTrue(s.is_con());
    assertEquals(1,cf._nevals);
    assertEquals(1,cf._nidents);
  }

  private static List<Expr> samples() {
    Var v = Var.make("v",Dtype.make(ScalarType.INT,4));
    return List.of(
      BinaryOp.add(con(0),BinaryOp.mul(X,con(1))),
      BinaryOp.add(Broadcast.make(BinaryOp.add(con(2),X),4),Ramp.make(BinaryOp.mul(Y,con(1)),con(2),4)),
      BinaryOp.mul(v,BinaryOp.add(Broadcast.make(con(1),4),Broadcast.make(con(0),4))),
      Cast.make(ScalarType.DOUBLE,BinaryOp.div(F,BinaryOp.sub(fcon(3f),fcon(1f)))),
      CompareSelect.make(BinaryOp.sub(X,con(0)),con(4),X,BinaryOp.mod(con(9),con(4)),CompareSelect.Op.GT),
      Intrinsics.make(Intrinsics.Op.ATAN2,BinaryOp.add(con(1),X),Intrinsics.make(Intrinsics.Op.COS,con(0))),
      Load.make(ScalarType.FLOAT,A,BinaryOp.add(Ramp.make(X,con(1),4),Broadcast.make(con(0),4))),
      BinaryOp.max(BinaryOp.min(fcon(Float.NaN),F,true),BinaryOp.div(fcon(1f),fcon(0f)),false)
    );
  }

  @Test public void testIdempotent() {
    for( Expr e : samples() ) {
      Expr f = fold(e);
      Expr ff = fold(f);
      assertEquals(e.toString(),f,ff);
      assertSame(e.toString(),f,ff);
    }
  }

  // Folding never changes the value, under random bindings
  @Test public void testEquivalence() {
    Random rnd = new Random(42);
    for( int trial=0; trial<500; trial++ ) {
      Expr e = random_tree(rnd,4);
      Expr f = fold(e);
      for( int k=0; k<4; k++ ) {
        ExprEval ev = new ExprEval()
          .bind(X,Value.make(Dtype.INT,rnd.nextInt(41)-20))
          .bind(Y,Value.make(Dtype.INT,rnd.nextInt()))
          .bind(F,Value.make(Dtype.FLOAT,(double)rnd.nextFloat()*8-4));
        assertEquals(e+" => "+f,ev.eval(e),ev.eval(f));
      }
    }
  }

  // Same, over 4-lane trees built from Broadcasts and Ramps of scalars
  @Test public void testVectorEquivalence() {
    Random rnd = new Random(7);
    for( int trial=0; trial<300; trial++ ) {
      Expr e = random_vector(rnd,3);
      Expr f = fold(e);
      assertEquals(e.dtype(),f.dtype());
      for( int k=0; k<4; k++ ) {
        ExprEval ev = new ExprEval()
          .bind(X,Value.make(Dtype.INT,rnd.nextInt(41)-20))
          .bind(Y,Value.make(Dtype.INT,rnd.nextInt()))
          .bind(F,Value.make(Dtype.FLOAT,(double)rnd.nextFloat()*8-4));
        assertEquals(e+" => "+f,ev.eval(e),ev.eval(f));
      }
    }
  }

  private static Expr random_vector( Random rnd, int depth ) {
    if( depth==0 || rnd.nextInt(4)==0 )
      return switch( rnd.nextInt(5) ) {
      case 0 -> Broadcast.make(X,4);
      case 1 -> Ramp.make(Y,con(rnd.nextInt(7)-3),4);
      case 2 -> Broadcast.make(con(rnd.nextInt(3)),4);
      case 3 -> Ramp.make(con(rnd.nextInt(11)-5),con(rnd.nextInt(5)-2),4);
      default -> Broadcast.make(random_tree(rnd,2),4);
      };
    Expr l = random_vector(rnd,depth-1), r = random_vector(rnd,depth-1);
    return switch( rnd.nextInt(5) ) {
    case 0 -> CompareSelect.make(l,r,r,l,CompareSelect.Op.values()[rnd.nextInt(6)]);
    case 1 -> BinaryOp.add(l,r);
    default -> BinaryOp.make(OPS[rnd.nextInt(OPS.length)],l,r,rnd.nextBoolean());
    };
  }

  private static final Kind[] OPS = {Kind.ADD,Kind.SUB,Kind.MUL,Kind.DIV,Kind.MOD,Kind.AND,Kind.OR,Kind.XOR,
                                     Kind.LSHIFT,Kind.RSHIFT,Kind.MAX,Kind.MIN};
  private static Expr random_tree( Random rnd, int depth ) {
    if( depth==0 || rnd.nextInt(4)==0 )
      return switch( rnd.nextInt(5) ) {
      case 0 -> X;
      case 1 -> Y;
      case 2 -> con(0);
      case 3 -> con(1);
      default -> con(rnd.nextInt(11)-5);
      };
    Expr l = random_tree(rnd,depth-1), r = random_tree(rnd,depth-1);
    return switch( rnd.nextInt(6) ) {
    case 0 -> CompareSelect.make(l,r,r,l,CompareSelect.Op.values()[rnd.nextInt(6)]);
    case 1 -> Cast.make(ScalarType.INT,BinaryOp.mul(Cast.make(ScalarType.FLOAT,l),F));
    default -> BinaryOp.make(OPS[rnd.nextInt(OPS.length)],l,r,rnd.nextBoolean());
    };
  }
}
