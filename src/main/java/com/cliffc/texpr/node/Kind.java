package com.cliffc.texpr.node;

// Every concrete expression variant.  Closed; the mutator and the evaluator
// switch over it exhaustively.
public enum Kind {
  INT_IMM, FLOAT_IMM, VAR, BROADCAST, RAMP,
  // Binary operators, contiguous
  ADD("+"), SUB("-"), MUL("*"), DIV("/"), MOD("%"),
  AND("&"), OR("|"), XOR("^"), LSHIFT("<<"), RSHIFT(">>"),
  MAX("Max"), MIN("Min"),
  COMPARE_SELECT, CAST, INTRINSICS, LOAD;

  public final String _op;      // Printed operator, binary ops only
  Kind() { this(null); }
  Kind( String op ) { _op=op; }

  public boolean is_binary() { return ADD.ordinal() <= ordinal() && ordinal() <= MIN.ordinal(); }
  // Only defined over integral and bool operands
  public boolean is_bitwise() { return AND.ordinal() <= ordinal() && ordinal() <= RSHIFT.ordinal(); }
}
