package com.cliffc.texpr.eval;

import com.cliffc.texpr.MalformedInputException;
import com.cliffc.texpr.type.Dtype;
import com.cliffc.texpr.type.ScalarType;
import com.cliffc.texpr.util.SB;

import java.util.Arrays;

/** A typed runtime value: one payload per lane, normalized to the element
 *  type.  Integral and bool lanes are longs, floating lanes are doubles. */
public final class Value {
  public final Dtype _dtype;
  private final long  [] _ls;   // Integral and bool lanes, else null
  private final double[] _ds;   // Floating lanes, else null

  private Value( Dtype dt, long[] ls, double[] ds ) { _dtype=dt; _ls=ls; _ds=ds; }

  // Integral or bool value.  Lanes are wrapped to the type.
  public static Value make( Dtype dt, long... ls ) {
    ScalarType st = dt._scalar;
    if( !st.is_integral() && !st.is_bool() )
      throw new MalformedInputException("Not an integer type: "+dt);
    if( ls.length != dt._lanes )
      throw new MalformedInputException("Expected "+dt._lanes+" lanes, got "+ls.length);
    long[] xs = new long[ls.length];
    for( int i=0; i<xs.length; i++ ) xs[i] = st.wrap(ls[i]);
    return new Value(dt,xs,null);
  }

  // Floating value.  Lanes are rounded to the type.
  public static Value make( Dtype dt, double... ds ) {
    ScalarType st = dt._scalar;
    if( !st.is_floating() )
      throw new MalformedInputException("Not a float type: "+dt);
    if( ds.length != dt._lanes )
      throw new MalformedInputException("Expected "+dt._lanes+" lanes, got "+ds.length);
    double[] xs = new double[ds.length];
    for( int i=0; i<xs.length; i++ ) xs[i] = st.round(ds[i]);
    return new Value(dt,null,xs);
  }

  // Buffer contents, one lane per element
  public static Value buffer( ScalarType st, long  ... ls ) { return make(Dtype.make(st,ls.length),ls); }
  public static Value buffer( ScalarType st, double... ds ) { return make(Dtype.make(st,ds.length),ds); }

  public boolean is_floating() { return _ds!=null; }
  public int lanes() { return _dtype._lanes; }
  public long   getl( int lane ) { assert _ls!=null; return _ls[lane]; }
  public double getd( int lane ) { assert _ds!=null; return _ds[lane]; }
  // Lane as a double, converting integers
  public double asd( int lane ) { return _ds!=null ? _ds[lane] : (double)_ls[lane]; }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof Value v) ) return false;
    return _dtype==v._dtype && Arrays.equals(_ls,v._ls) && Arrays.equals(_ds,v._ds);
  }
  @Override public int hashCode() { return _dtype.hashCode()*31 + (_ls!=null ? Arrays.hashCode(_ls) : Arrays.hashCode(_ds)); }

  @Override public String toString() {
    SB sb = new SB();
    if( lanes() > 1 ) sb.p('[');
    for( int i=0; i<lanes(); i++ ) {
      if( _ls!=null ) sb.p(_ls[i]); else sb.p(_ds[i]);
      sb.p(", ");
    }
    sb.unchar(2);
    if( lanes() > 1 ) sb.p(']');
    return sb.p(':').p(_dtype._scalar._name).toString();
  }
}
