package com.cliffc.texpr.type;

import com.cliffc.texpr.MalformedInputException;
import com.cliffc.texpr.util.Half;

import static com.cliffc.texpr.TX.unimpl;

// Element types of the tensor IR.  Order matters: the integral types come
// first, smallest to largest.
public enum ScalarType {
  BYTE  ("uint8" ,1),           // Unsigned 8 bit
  CHAR  ("int8"  ,1),           // Signed 8 bit
  SHORT ("int16" ,2),
  INT   ("int32" ,4),
  LONG  ("int64" ,8),
  HALF  ("half"  ,2),
  FLOAT ("float" ,4),
  DOUBLE("double",8),
  BOOL  ("bool"  ,1),
  HANDLE("handle",8);           // Opaque buffer pointer; not a numeric type

  public final String _name;    // Printed name
  public final int _bytes;      // Storage size
  ScalarType( String name, int bytes ) { _name=name; _bytes=bytes; }

  public boolean is_integral() { return ordinal() <= LONG.ordinal(); }
  public boolean is_floating() { return this==HALF || this==FLOAT || this==DOUBLE; }
  public boolean is_bool    () { return this==BOOL; }
  // Integral and bool payloads are carried in a long, floats in a double
  public boolean is_numeric () { return this!=HANDLE; }
  public boolean is_signed  () { return this!=BYTE && this!=BOOL && this!=HANDLE; }

  // Wrap a long into this integral (or bool) type, C style.
  public long wrap( long v ) {
    return switch( this ) {
    case BYTE  -> v & 0xFF;
    case CHAR  -> (byte)v;
    case SHORT -> (short)v;
    case INT   -> (int)v;
    case LONG  -> v;
    case BOOL  -> v==0 ? 0 : 1;
    default    -> throw unimpl("wrap on "+this);
    };
  }

  // Round a double to the precision of this floating type.
  public double round( double d ) {
    return switch( this ) {
    case HALF   -> Half.round((float)d);
    case FLOAT  -> (float)d;
    case DOUBLE -> d;
    default     -> throw unimpl("round on "+this);
    };
  }

  // Type of a binary operation over two element types: bool gives way to
  // anything, floats beat integers, wider beats narrower, and mixing signed
  // and unsigned bytes widens to a short.
  public static ScalarType promote( ScalarType a, ScalarType b ) {
    if( a==b ) return a;
    if( a==HANDLE || b==HANDLE ) throw new MalformedInputException("Cannot promote "+a._name+" and "+b._name);
    if( a==BOOL ) return b;
    if( b==BOOL ) return a;
    if( a.is_floating() != b.is_floating() ) return a.is_floating() ? a : b;
    if( (a==BYTE && b==CHAR) || (a==CHAR && b==BYTE) ) return SHORT;
    return a._bytes >= b._bytes ? a : b;
  }

  // Lookup by printed name, or null
  public static ScalarType valueOfName( String name ) {
    for( ScalarType st : values() )
      if( st._name.equals(name) )
        return st;
    return null;
  }

  @Override public String toString() { return _name; }
}
