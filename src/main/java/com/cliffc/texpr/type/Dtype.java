package com.cliffc.texpr.type;

import com.cliffc.texpr.MalformedInputException;
import com.cliffc.texpr.util.SB;

import java.util.concurrent.ConcurrentHashMap;

/** Element type plus vector lane count.
 *  <p>
 *  Dtypes are hash-consed: there is exactly one instance per (scalar, lanes)
 *  pair, so they compare with {@code ==}. */
public final class Dtype {
  public final ScalarType _scalar;
  public final int _lanes;
  private Dtype( ScalarType scalar, int lanes ) { _scalar=scalar; _lanes=lanes; }

  private static final ConcurrentHashMap<Long,Dtype> INTERN = new ConcurrentHashMap<>();

  public static Dtype make( ScalarType scalar, int lanes ) {
    if( lanes < 1 ) throw new MalformedInputException("Lane count must be positive: "+lanes);
    Long key = ((long)lanes<<4) | scalar.ordinal();
    return INTERN.computeIfAbsent(key, k -> new Dtype(scalar,lanes));
  }
  public static Dtype make( ScalarType scalar ) { return make(scalar,1); }

  public static final Dtype BYTE   = make(ScalarType.BYTE  );
  public static final Dtype CHAR   = make(ScalarType.CHAR  );
  public static final Dtype SHORT  = make(ScalarType.SHORT );
  public static final Dtype INT    = make(ScalarType.INT   );
  public static final Dtype LONG   = make(ScalarType.LONG  );
  public static final Dtype HALF   = make(ScalarType.HALF  );
  public static final Dtype FLOAT  = make(ScalarType.FLOAT );
  public static final Dtype DOUBLE = make(ScalarType.DOUBLE);
  public static final Dtype BOOL   = make(ScalarType.BOOL  );
  public static final Dtype HANDLE = make(ScalarType.HANDLE);

  public Dtype with_lanes( int lanes ) { return make(_scalar,lanes); }
  public Dtype with_scalar( ScalarType scalar ) { return make(scalar,_lanes); }
  public boolean is_scalar() { return _lanes==1; }

  // Promote two dtypes for a binary operation.  Lanes must agree.
  public static Dtype promote( Dtype a, Dtype b ) {
    if( a==b ) return a;
    if( a._lanes != b._lanes )
      throw new MalformedInputException("Lane mismatch: "+a+" and "+b);
    return make(ScalarType.promote(a._scalar,b._scalar),a._lanes);
  }

  // Parse "int32", "floatx4" and the like; null if not a dtype name.
  public static Dtype valueOfName( String s ) {
    int x = s.indexOf('x');
    ScalarType st = ScalarType.valueOfName(x == -1 ? s : s.substring(0,x));
    if( st==null ) return null;
    if( x == -1 ) return make(st);
    try { return make(st,Integer.parseInt(s.substring(x+1))); }
    catch( NumberFormatException nfe ) { return null; }
  }

  public SB str( SB sb ) {
    sb.p(_scalar._name);
    return _lanes==1 ? sb : sb.p('x').p(_lanes);
  }
  @Override public String toString() { return str(new SB()).toString(); }
}
