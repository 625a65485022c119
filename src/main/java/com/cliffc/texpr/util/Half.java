package com.cliffc.texpr.util;

/** IEEE 754 binary16 support.  Half values are carried as floats (or
 *  doubles) holding exactly-representable half precision numbers. */
public abstract class Half {
  public static final float MAX = 65504f;
  // Smallest normal half, 2^-14
  private static final float MIN_NORMAL = 0x1p-14f;
  // Magnitudes at or above this round to infinity: halfway between MAX and 2^16
  private static final float OVERFLOW = 65520f;

  // Round a float to the nearest half, ties to even.
  public static float round( float f ) {
    if( Float.isNaN(f) || Float.isInfinite(f) ) return f;
    float a = Math.abs(f);
    if( a >= OVERFLOW ) return Math.copySign(Float.POSITIVE_INFINITY,f);
    // Spacing of halves at this magnitude: fixed 2^-24 in the subnormal
    // range, else 10 fraction bits below the leading bit.
    int exp = a < MIN_NORMAL ? -14 : Math.getExponent(a);
    double ulp = Math.scalb(1.0,exp-10);
    return Math.copySign((float)(Math.rint(a/ulp)*ulp),f);
  }

  // Encode an already-rounded half into its 16 bits
  public static short to_bits( float f ) {
    int bits = Float.floatToIntBits(f);
    int sign = (bits >>> 16) & 0x8000;
    if( Float.isNaN(f) ) return (short)(sign | 0x7E00);
    float a = Math.abs(round(f));
    if( Float.isInfinite(a) ) return (short)(sign | 0x7C00);
    if( a < MIN_NORMAL )        // Subnormal: count of 2^-24 quanta
      return (short)(sign | (int)(a * 0x1p24f));
    int abits = Float.floatToIntBits(a);
    int exp = ((abits >>> 23) & 0xFF) - 127 + 15;
    int mantissa = (abits >>> 13) & 0x3FF;
    return (short)(sign | (exp << 10) | mantissa);
  }

  public static float from_bits( short h ) {
    int sign = (h & 0x8000) << 16;
    int exp = (h >>> 10) & 0x1F;
    int mantissa = h & 0x03FF;
    if( exp == 0 )              // Zero or subnormal
      return Math.copySign(mantissa * 0x1p-24f, Float.intBitsToFloat(sign | 0x3F800000));
    if( exp == 31 )
      return Float.intBitsToFloat(sign | 0x7F800000 | (mantissa << 13));
    return Float.intBitsToFloat(sign | ((exp + 127 - 15) << 23) | (mantissa << 13));
  }
}
