package com.cliffc.texpr;

import com.cliffc.texpr.node.*;
import com.cliffc.texpr.type.Dtype;
import com.cliffc.texpr.type.ScalarType;
import com.cliffc.texpr.util.SB;
import org.jetbrains.annotations.NotNull;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;

/** Recursive-descent parser for the printed expression form.
 *
 *  <pre>
 *  expr := bin [ '?' expr ':' expr ]      // '?' needs a bare comparison on the left
 *  bin  := term { op term }               // C precedence, low to high:
 *                                         //   |  ^  &  == !=  < <= > >=  << >>  + -  * / %
 *  term := '(' expr ')'
 *       |  number [':'scalar]             // 5  -5  1.5  3:int64  1.5:double
 *       |  nan | inf | -inf               // float, with optional ':'scalar
 *       |  Broadcast(expr, lanes) | Ramp(expr, expr, lanes)
 *       |  Max(expr, expr [, 0|1]) | Min(expr, expr [, 0|1])
 *       |  dtype(expr)                    // cast, e.g. float(x)
 *       |  intrinsic(expr, ...)           // sin(x)  pow(x, 2)  rand()
 *       |  id[':'scalar] '[' expr [, expr] ']'  // load, default element type float
 *       |  id[':'dtype]                   // variable, default int32, e.g. v:floatx4
 *  </pre>
 *  The same name is the same {@link Var} throughout one parse.  Annotations
 *  must follow without whitespace, so the ':' of a select is never mistaken
 *  for one.  Syntax errors raise {@link MalformedInputException} with the
 *  source, position and a caret under the offending spot.
 */
public class Parse {
  private final String _src;    // Source name, for errors
  private final String _str;    // Text being parsed
  private final byte[] _buf;    // Bytes being parsed
  private int _x;               // Parser index
  private final HashMap<String,Var> _vars = new HashMap<>();
  private CompareSelect _cmp;   // Last select built by a comparison operator

  public Parse( String src, String str ) {
    _src = src;
    _str = str;
    _buf = str.getBytes(StandardCharsets.UTF_8);
    _x   = 0;
  }

  public static @NotNull Expr parse( String str ) { return new Parse("expr",str).go(); }

  // Parse the whole string as one expression
  public @NotNull Expr go() {
    if( skipWS() == -1 ) throw err("Expected an expression");
    Expr e = expr();
    if( skipWS() != -1 ) throw err("Syntax error; trailing junk");
    return e;
  }

  // Variables seen so far, by name
  public Var var( String name ) { return _vars.get(name); }

  private Expr expr() {
    int x = skipX();
    Expr e = bin(0);
    if( !peek('?') ) return e;
    // Only a bare comparison; a select already carrying results is not one
    if( !(e instanceof CompareSelect cs) || cs != _cmp ) { _x = x; throw err("Expected a comparison before '?'"); }
    Expr t = expr();
    require(':');
    Expr f = expr();
    return CompareSelect.make(cs._lhs,cs._rhs,t,f,cs._op);
  }

  private static final int MAX_PREC = 7;

  // Left-associative binary operators at precedence 'prec' and above
  private Expr bin( int prec ) {
    if( prec > MAX_PREC ) return term();
    Expr lhs = bin(prec+1);
    while( true ) {
      int opx = skipX();
      String op = binop(prec);
      if( op==null ) { _x = opx; return lhs; }
      Expr rhs = bin(prec+1);
      lhs = make(op,lhs,rhs);
      if( lhs instanceof CompareSelect cs ) _cmp = cs;
    }
  }

  // Operator at exactly this precedence level, or null.  Consumes it if found.
  private String binop( int prec ) {
    if( skipWS() == -1 ) return null;
    byte c = _buf[_x];
    byte c1 = _x+1 < _buf.length ? _buf[_x+1] : 0;
    String op = switch( prec ) {
    case 0 -> c=='|' ? "|" : null;
    case 1 -> c=='^' ? "^" : null;
    case 2 -> c=='&' ? "&" : null;
    case 3 -> (c=='=' || c=='!') && c1=='=' ? (c=='=' ? "==" : "!=") : null;
    case 4 -> (c=='<' || c=='>') && c1!=c ? (c1=='=' ? (c=='<' ? "<=" : ">=") : (c=='<' ? "<" : ">")) : null;
    case 5 -> (c=='<' || c=='>') && c1==c ? (c=='<' ? "<<" : ">>") : null;
    case 6 -> c=='+' || c=='-' ? (c=='+' ? "+" : "-") : null;
    case 7 -> c=='*' || c=='/' || c=='%' ? String.valueOf((char)c) : null;
    default -> null;
    };
    if( op!=null ) _x += op.length();
    return op;
  }

  private static Expr make( String op, Expr l, Expr r ) {
    return switch( op ) {
    case "|"  -> BinaryOp.or (l,r);
    case "^"  -> BinaryOp.xor(l,r);
    case "&"  -> BinaryOp.and(l,r);
    case "==" -> CompareSelect.make(l,r,CompareSelect.Op.EQ);
    case "!=" -> CompareSelect.make(l,r,CompareSelect.Op.NE);
    case "<"  -> CompareSelect.make(l,r,CompareSelect.Op.LT);
    case "<=" -> CompareSelect.make(l,r,CompareSelect.Op.LE);
    case ">"  -> CompareSelect.make(l,r,CompareSelect.Op.GT);
    case ">=" -> CompareSelect.make(l,r,CompareSelect.Op.GE);
    case "<<" -> BinaryOp.shl(l,r);
    case ">>" -> BinaryOp.shr(l,r);
    case "+"  -> BinaryOp.add(l,r);
    case "-"  -> BinaryOp.sub(l,r);
    case "*"  -> BinaryOp.mul(l,r);
    case "/"  -> BinaryOp.div(l,r);
    case "%"  -> BinaryOp.mod(l,r);
    default   -> throw TX.unimpl(op);
    };
  }

  private Expr term() {
    byte c = skipWS();
    if( c == -1 ) throw err("Expected an expression but ran out of text");
    if( peek('(') ) {
      Expr e = expr();
      require(')');
      return e;
    }
    if( isDigit(c) || c=='-' || c=='.' ) return number();
    if( !isAlpha0(c) ) throw err("Unexpected '"+(char)c+"'");
    int x = _x;
    String id = id();
    if( id.equals("nan") || id.equals("inf") )
      return fimm(id.equals("nan") ? Double.NaN : Double.POSITIVE_INFINITY,x);
    if( peek('(') ) return call(id,x);
    Dtype dt = annotation();
    if( peek('[') ) return load(id,scalar(dt,x),x);
    return var(id,dt,x);
  }

  // Signed int or float literal
  private Expr number() {
    int x = _x;
    boolean neg = _buf[_x]=='-';
    if( neg ) _x++;
    if( _x < _buf.length && isAlpha0(_buf[_x]) ) { // -inf
      if( !id().equals("inf") ) { _x = x; throw err("Expected a number"); }
      return fimm(Double.NEGATIVE_INFINITY,x);
    }
    int start = _x;
    boolean is_float = false;
    while( _x < _buf.length ) {
      byte c = _buf[_x];
      boolean exp_sign = (c=='-' || c=='+') && (_buf[_x-1]=='E' || _buf[_x-1]=='e');
      if( c=='.' || c=='E' || c=='e' ) is_float = true;
      else if( !isDigit(c) && !exp_sign ) break;
      _x++;
    }
    String s = _str.substring(start,_x);
    if( s.isEmpty() ) { _x = x; throw err("Expected a number"); }
    try {
      if( is_float ) return fimm(neg ? -Double.parseDouble(s) : Double.parseDouble(s),x);
      return iimm(Long.parseLong(neg ? "-"+s : s),x);
    } catch( NumberFormatException nfe ) {
      _x = x;
      throw err("Malformed number '"+(neg ? "-" : "")+s+"'");
    }
  }

  private Expr iimm( long l, int x ) {
    ScalarType st = scalar(annotation(),x);
    if( st==null ) return IntImm.con(l);
    if( st.is_floating() ) return FloatImm.make(st,l);
    if( !st.is_numeric() ) { _x = x; throw err("No "+st+" immediates"); }
    return IntImm.make(st,l);
  }
  private Expr fimm( double d, int x ) {
    ScalarType st = scalar(annotation(),x);
    if( st==null ) return FloatImm.make(ScalarType.FLOAT,d);
    if( !st.is_floating() ) { _x = x; throw err("Float immediate typed as "+st); }
    return FloatImm.make(st,d);
  }

  // ':'dtype immediately after a token, or null.  A ':' not followed by a
  // type name is left alone.
  private Dtype annotation() {
    if( _x >= _buf.length || _buf[_x]!=':' ) return null;
    int x = _x++;
    if( _x >= _buf.length || !isAlpha0(_buf[_x]) ) { _x = x; return null; }
    Dtype dt = Dtype.valueOfName(id());
    if( dt==null ) _x = x;
    return dt;
  }
  // Element type of an annotation that must not be a vector
  private ScalarType scalar( Dtype dt, int x ) {
    if( dt==null ) return null;
    if( !dt.is_scalar() ) { _x = x; throw err("Expected a scalar type, not "+dt); }
    return dt._scalar;
  }

  private Expr call( String id, int x ) {
    switch( id ) {
    case "Broadcast": {
      Expr v = expr();
      require(',');
      int lanes = lanes();
      require(')');
      return Broadcast.make(v,lanes);
    }
    case "Ramp": {
      Expr base = expr();
      require(',');
      Expr stride = expr();
      require(',');
      int lanes = lanes();
      require(')');
      return Ramp.make(base,stride,lanes);
    }
    case "Max":
    case "Min": {
      Expr l = expr();
      require(',');
      Expr r = expr();
      boolean propagate_nans = false;
      if( peek(',') ) {
        int fx = skipX();
        long flag = lanes_or_flag();
        if( flag!=0 && flag!=1 ) { _x = fx; throw err("Expected a NaN flag of 0 or 1"); }
        propagate_nans = flag==1;
      }
      require(')');
      return id.equals("Max") ? BinaryOp.max(l,r,propagate_nans) : BinaryOp.min(l,r,propagate_nans);
    }
    }
    ScalarType st = ScalarType.valueOfName(id);
    if( st != null ) {
      Expr src = expr();
      require(')');
      return Cast.make(st,src);
    }
    Intrinsics.Op op = Intrinsics.Op.valueOfName(id);
    if( op == null ) { _x = x; throw err("Unknown function '"+id+"'"); }
    Expr[] args = new Expr[op._nargs];
    for( int i=0; i<args.length; i++ ) {
      if( i > 0 ) require(',');
      args[i] = expr();
    }
    require(')');
    return Intrinsics.make(op,args);
  }

  private int lanes() {
    int x = skipX();
    long l = lanes_or_flag();
    if( l < 1 || l > Integer.MAX_VALUE ) { _x = x; throw err("Expected a positive lane count"); }
    return (int)l;
  }
  // Bare non-negative integer
  private long lanes_or_flag() {
    int x = skipX();
    while( _x < _buf.length && isDigit(_buf[_x]) ) _x++;
    if( x==_x ) throw err("Expected an integer");
    try { return Long.parseLong(_str.substring(x,_x)); }
    catch( NumberFormatException nfe ) { _x = x; throw err("Integer too large"); }
  }

  private Expr load( String id, ScalarType st, int x ) {
    Var base = var(id,Dtype.HANDLE,x);
    Expr index = expr();
    Expr mask = peek(',') ? expr() : null;
    require(']');
    st = st==null ? ScalarType.FLOAT : st;
    return mask==null ? Load.make(st,base,index) : Load.make(st,base,index,mask);
  }

  // Find or make the named variable.  A null dtype accepts any earlier one.
  private Var var( String id, Dtype dt, int x ) {
    Var v = _vars.get(id);
    if( v == null ) {
      v = Var.make(id,dt==null ? Dtype.INT : dt);
      _vars.put(id,v);
      return v;
    }
    if( dt != null && v._dtype != dt ) { _x = x; throw err("'"+id+"' is a "+v._dtype+", not a "+dt); }
    return v;
  }

  private String id() {
    int x = _x;
    while( _x < _buf.length && isAlpha1(_buf[_x]) ) _x++;
    return _str.substring(x,_x);
  }

  private void require( char c ) {
    if( peek(c) ) return;
    throw err("Expected '"+c+"' but "+(_x>=_buf.length ? "ran out of text" : "found '"+(char)_buf[_x]+"' instead"));
  }

  /** Advance parse pointer to the first non-whitespace character, and return
   *  that character, -1 otherwise.  */
  private byte skipWS() {
    while( _x < _buf.length ) {
      byte c = _buf[_x];
      if( !isWS(c) ) return c;
      _x++;
    }
    return -1;
  }
  private int skipX() { skipWS(); return _x; }

  // Skip WS, return true&skip if match, false & do not skip if miss.
  private boolean peek( char c ) {
    if( skipWS() != c ) return false;
    _x++;
    return true;
  }

  private static boolean isWS    (byte c) { return c == ' ' || c == '\t' || c == '\n' || c == '\r'; }
  private static boolean isAlpha0(byte c) { return ('a'<=c && c <= 'z') || ('A'<=c && c <= 'Z') || (c=='_'); }
  private static boolean isAlpha1(byte c) { return isAlpha0(c) || isDigit(c); }
  private static boolean isDigit (byte c) { return '0' <= c && c <= '9'; }

  // Syntax error at the current position, with the line and a caret
  private MalformedInputException err( String msg ) {
    SB sb = new SB().p(_src).p(':').p(_x).p(": ").p(msg).nl();
    sb.p(_str).nl();
    for( int i=0; i<_x; i++ ) sb.p(' ');
    return new MalformedInputException(sb.p('^').toString());
  }
}
