package com.cliffc.texpr.util;

public abstract class Util {
  // Mix a new value into a running hash.  Murmur3 finalizer constants.
  public static int mix_hash( int h, int x ) {
    h ^= x * 0xcc9e2d51;
    h = (h << 13) | (h >>> 19);
    h = h*5 + 0xe6546b64;
    h ^= h >>> 16;
    h *= 0x85ebca6b;
    h ^= h >>> 13;
    return h;
  }
  public static int mix_hash( int h, long x ) { return mix_hash(mix_hash(h,(int)x),(int)(x>>>32)); }

  // Bitwise double equality: NaN equals NaN, and 0.0 differs from -0.0
  public static boolean eq( double d0, double d1 ) {
    return Double.doubleToLongBits(d0)==Double.doubleToLongBits(d1);
  }
}
