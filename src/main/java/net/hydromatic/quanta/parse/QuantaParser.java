/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.quanta.parse;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.quanta.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.quanta.ast.Ast;
import net.hydromatic.quanta.ast.Modifier;
import net.hydromatic.quanta.ast.Op;
import net.hydromatic.quanta.ast.Pos;
import net.hydromatic.quanta.type.RegisterType;

/**
 * Recursive-descent parser for Quanta programs.
 *
 * <p>The parser checks syntax only. It accepts any identifier as the target
 * of a call, and leaves it to semantic analysis to decide what the
 * identifier means. It stops at the first unexpected token, throwing
 * {@link ParseException}.
 */
public class QuantaParser {
  private final String file;
  private final List<Token> tokens;
  /** Index of the next token. */
  private int i = 0;

  /** Creates a parser. Throws {@link LexException} if the source cannot be
   * tokenized. */
  public QuantaParser(String file, String source) {
    this.file = requireNonNull(file);
    this.tokens = Lexer.tokenize(file, source);
  }

  /** Parses a program. */
  public static Ast.Program parse(String file, String source) {
    return new QuantaParser(file, source).program();
  }

  /** Parses a program, up to and including the end of input. */
  public Ast.Program program() {
    final Pos start = peek().pos(file);
    final List<Ast.Stmt> statements = new ArrayList<>();
    skipSeparators();
    while (peek().kind != TokenKind.EOF) {
      statements.add(statement());
      if (peek().kind != TokenKind.EOF) {
        expectSeparator("end of input");
      }
      skipSeparators();
    }
    return ast.program(
        statements.isEmpty() ? start : Pos.sum(statements), statements);
  }

  /** Parses an expression, up to and including the end of input. */
  public Ast.Exp expressionEof() {
    final Ast.Exp e = expression();
    skipSeparators();
    expect(TokenKind.EOF);
    return e;
  }

  /** Returns the position of the most recently consumed token. */
  Pos pos() {
    return tokens.get(Math.max(i - 1, 0)).pos(file);
  }

  private Span span() {
    return Span.of(pos());
  }

  // statements

  private Ast.Stmt statement() {
    final Token t = peek();
    switch (t.kind) {
      case QUBIT:
      case BIT:
        return quantumDecl();
      case VAR:
      case CONST:
        return varDecl();
      case DEF:
        return funDecl();
      case GATE:
        return gateDecl();
      case CLASS:
        return classDecl();
      case FOR:
        return forStmt();
      case IF:
        return ifStmt();
      case RETURN:
        return returnStmt();
      default:
        return simpleStmt();
    }
  }

  private Ast.QuantumDecl quantumDecl() {
    final Token t = next();
    final Span s = span();
    final RegisterType.Kind kind = t.kind == TokenKind.QUBIT
        ? RegisterType.Kind.QUBIT
        : RegisterType.Kind.BIT;
    Ast.Exp size = null;
    if (accept(TokenKind.LBRACKET)) {
      size = expression();
      expect(TokenKind.RBRACKET);
    }
    final String name = expect(TokenKind.IDENTIFIER).text;
    return ast.quantumDecl(s.end(this), kind, size, name);
  }

  private Ast.VarDecl varDecl() {
    final Token t = next();
    final Span s = span();
    final Op op = t.kind == TokenKind.VAR ? Op.VAR_DECL : Op.CONST_DECL;
    final String name = expect(TokenKind.IDENTIFIER).text;
    Ast.TypeExp type = null;
    if (accept(TokenKind.COLON)) {
      type = type();
    }
    expect(TokenKind.ASSIGN);
    final Ast.Exp exp = expression();
    return ast.varDecl(s.end(exp), op, name, type, exp);
  }

  private Ast.FunDecl funDecl() {
    expect(TokenKind.DEF);
    final Span s = span();
    final String name = expect(TokenKind.IDENTIFIER).text;
    final List<Ast.Param> params = params();
    Ast.TypeExp returnType = null;
    if (accept(TokenKind.ARROW)) {
      returnType = type();
    }
    final Ast.Block body = block();
    return ast.funDecl(s.end(body), name, params, returnType, body);
  }

  private Ast.GateDecl gateDecl() {
    expect(TokenKind.GATE);
    final Span s = span();
    final String name = expect(TokenKind.IDENTIFIER).text;
    final List<Ast.Param> params = params();
    final Ast.Block body = block();
    return ast.gateDecl(s.end(body), name, params, body);
  }

  private List<Ast.Param> params() {
    expect(TokenKind.LPAREN);
    final List<Ast.Param> params = new ArrayList<>();
    if (!accept(TokenKind.RPAREN)) {
      do {
        final Token name = expect(TokenKind.IDENTIFIER);
        final Span s = span();
        Ast.TypeExp type = null;
        if (accept(TokenKind.COLON)) {
          type = type();
        }
        params.add(ast.param(s.end(this), name.text, type));
      } while (accept(TokenKind.COMMA));
      expect(TokenKind.RPAREN);
    }
    return params;
  }

  private Ast.ClassDecl classDecl() {
    expect(TokenKind.CLASS);
    final Span s = span();
    final String name = expect(TokenKind.IDENTIFIER).text;
    final Ast.Block body = block();
    return ast.classDecl(s.end(body), name, body.statements);
  }

  private Ast.For forStmt() {
    expect(TokenKind.FOR);
    final Span s = span();
    final boolean paren = accept(TokenKind.LPAREN);
    final String iterator = expect(TokenKind.IDENTIFIER).text;
    expect(TokenKind.IN);
    final Ast.Exp iterable = expression();
    if (paren) {
      expect(TokenKind.RPAREN);
    }
    final Ast.Block body = block();
    return ast.forLoop(s.end(body), iterator, iterable, body);
  }

  private Ast.If ifStmt() {
    next(); // "if" or "elif"
    final Span s = span();
    final Ast.Exp condition = expression();
    final Ast.Block ifTrue = block();
    Ast.Block ifFalse = null;
    switch (peekPastNewlines().kind) {
      case ELIF:
        skipNewlines();
        final Ast.If elif = ifStmt();
        ifFalse = ast.block(elif.pos, ImmutableList.of(elif));
        break;
      case ELSE:
        skipNewlines();
        next();
        ifFalse = block();
        break;
      default:
        break;
    }
    return ast.ifThenElse(s.end(this), condition, ifTrue, ifFalse);
  }

  private Ast.Return returnStmt() {
    expect(TokenKind.RETURN);
    final Span s = span();
    switch (peek().kind) {
      case NEWLINE:
      case SEMICOLON:
      case RBRACE:
      case EOF:
        return ast.returnStmt(s.pos(), null);
      default:
        final Ast.Exp exp = expression();
        return ast.returnStmt(s.end(exp), exp);
    }
  }

  private Ast.Stmt simpleStmt() {
    final Ast.Exp exp = expression();
    final Token t = peek();
    final Op op =
        t.kind.text == null ? null : Op.ASSIGN_BY_TOKEN.get(t.kind.text);
    if (op == null) {
      return ast.expStmt(exp.pos, exp);
    }
    if (!(exp instanceof Ast.Id)) {
      throw new ParseException(t,
          ImmutableList.of(TokenKind.NEWLINE.describe(),
              TokenKind.SEMICOLON.describe()),
          file);
    }
    next();
    final Ast.Exp value = expression();
    return ast.assign(Span.of(exp).end(value), op, (Ast.Id) exp, value);
  }

  private Ast.Block block() {
    expect(TokenKind.LBRACE);
    final Span s = span();
    final List<Ast.Stmt> statements = new ArrayList<>();
    skipSeparators();
    while (peek().kind != TokenKind.RBRACE) {
      statements.add(statement());
      if (peek().kind != TokenKind.RBRACE) {
        expectSeparator(TokenKind.RBRACE.describe());
      }
      skipSeparators();
    }
    expect(TokenKind.RBRACE);
    return ast.block(s.end(this), statements);
  }

  private Ast.TypeExp type() {
    final Token t = next();
    switch (t.kind) {
      case INT:
      case FLOAT:
      case BOOL:
      case STR:
      case QUBIT:
      case BIT:
        break;
      default:
        throw new ParseException(t, ImmutableList.of("type"), file);
    }
    final Span s = span();
    boolean array = false;
    Integer size = null;
    if (accept(TokenKind.LBRACKET)) {
      array = true;
      if (peek().kind == TokenKind.INT_LITERAL) {
        size = (Integer) next().value;
      }
      expect(TokenKind.RBRACKET);
    }
    return ast.typeExp(s.end(this), t.text, array, size);
  }

  // expressions

  /** Parses an expression. */
  public Ast.Exp expression() {
    return or();
  }

  private Ast.Exp or() {
    Ast.Exp e = and();
    while (accept(TokenKind.OR)) {
      final Ast.Exp e2 = and();
      e = ast.infixCall(Span.of(e).end(e2), Op.OR, e, e2);
    }
    return e;
  }

  private Ast.Exp and() {
    Ast.Exp e = not();
    while (accept(TokenKind.AND)) {
      final Ast.Exp e2 = not();
      e = ast.infixCall(Span.of(e).end(e2), Op.AND, e, e2);
    }
    return e;
  }

  private Ast.Exp not() {
    if (accept(TokenKind.NOT)) {
      final Span s = span();
      final Ast.Exp e = not();
      return ast.prefixCall(s.end(e), Op.NOT, e);
    }
    return comparison();
  }

  private Ast.Exp comparison() {
    final Ast.Exp e = additive();
    final Op op;
    switch (peek().kind) {
      case EQ_EQ:
        op = Op.EQ;
        break;
      case NE:
        op = Op.NE;
        break;
      case LT:
        op = Op.LT;
        break;
      case LE:
        op = Op.LE;
        break;
      case GT:
        op = Op.GT;
        break;
      case GE:
        op = Op.GE;
        break;
      default:
        return e;
    }
    next();
    final Ast.Exp e2 = additive();
    return ast.infixCall(Span.of(e).end(e2), op, e, e2);
  }

  private Ast.Exp additive() {
    Ast.Exp e = term();
    for (;;) {
      final Op op;
      if (accept(TokenKind.PLUS)) {
        op = Op.PLUS;
      } else if (accept(TokenKind.MINUS)) {
        op = Op.MINUS;
      } else {
        return e;
      }
      final Ast.Exp e2 = term();
      e = ast.infixCall(Span.of(e).end(e2), op, e, e2);
    }
  }

  private Ast.Exp term() {
    Ast.Exp e = unary();
    for (;;) {
      final Op op;
      switch (peek().kind) {
        case STAR:
          op = Op.TIMES;
          break;
        case SLASH:
          op = Op.DIVIDE;
          break;
        case SLASH_SLASH:
          op = Op.FLOOR_DIVIDE;
          break;
        case PERCENT:
          op = Op.MOD;
          break;
        default:
          return e;
      }
      next();
      final Ast.Exp e2 = unary();
      e = ast.infixCall(Span.of(e).end(e2), op, e, e2);
    }
  }

  private Ast.Exp unary() {
    if (accept(TokenKind.MINUS)) {
      final Span s = span();
      final Ast.Exp e = unary();
      return ast.prefixCall(s.end(e), Op.NEGATE, e);
    }
    if (accept(TokenKind.PLUS)) {
      return unary();
    }
    return power();
  }

  private Ast.Exp power() {
    final Ast.Exp e = postfix();
    if (accept(TokenKind.STAR_STAR)) {
      final Ast.Exp e2 = unary();
      return ast.infixCall(Span.of(e).end(e2), Op.POWER, e, e2);
    }
    return e;
  }

  private Ast.Exp postfix() {
    Ast.Exp e = primary();
    for (;;) {
      final Token t = peek();
      switch (t.kind) {
        case LPAREN:
          if (!(e instanceof Ast.Id)) {
            throw new ParseException(t, ImmutableList.of(), file);
          }
          next();
          final List<Ast.Exp> args = args();
          e = ast.call(Span.of(e).end(this), ((Ast.Id) e).name,
              ImmutableList.of(), args);
          break;
        case LBRACKET:
          next();
          final Ast.Exp index = expression();
          expect(TokenKind.RBRACKET);
          e = ast.index(Span.of(e).end(this), e, index);
          break;
        case DAGGER:
          if (!(e instanceof Ast.Call)) {
            throw new ParseException(t, ImmutableList.of(), file);
          }
          next();
          final Ast.Call call = (Ast.Call) e;
          e = ast.call(Span.of(e).end(this), call.name,
              ImmutableList.<Modifier>builder().addAll(call.modifiers)
                  .add(Modifier.INV).build(),
              call.args);
          break;
        default:
          return e;
      }
    }
  }

  /** Parses call arguments, after the opening parenthesis. */
  private List<Ast.Exp> args() {
    final List<Ast.Exp> args = new ArrayList<>();
    if (!accept(TokenKind.RPAREN)) {
      do {
        args.add(expression());
      } while (accept(TokenKind.COMMA));
      expect(TokenKind.RPAREN);
    }
    return args;
  }

  private Ast.Exp primary() {
    final Token t = next();
    final Span s = span();
    switch (t.kind) {
      case INT_LITERAL:
        return ast.intLiteral(s.pos(), (Integer) requireNonNull(t.value));
      case FLOAT_LITERAL:
        return ast.floatLiteral(s.pos(), (Double) requireNonNull(t.value));
      case STRING_LITERAL:
        return ast.stringLiteral(s.pos(), (String) requireNonNull(t.value));
      case TRUE:
        return ast.boolLiteral(s.pos(), true);
      case FALSE:
        return ast.boolLiteral(s.pos(), false);
      case IDENTIFIER:
        if (accept(TokenKind.DOT)) {
          final Token member = expect(TokenKind.IDENTIFIER);
          return ast.id(s.end(this), t.text + "." + member.text);
        }
        return ast.id(s.pos(), t.text);
      case INT:
      case FLOAT:
        // Type names double as conversion functions, "int(x)"
        if (peek().kind != TokenKind.LPAREN) {
          throw new ParseException(t, ImmutableList.of("expression"), file);
        }
        return ast.id(s.pos(), t.text);
      case LPAREN:
        final Ast.Exp e = expression();
        expect(TokenKind.RPAREN);
        return e;
      case LBRACKET:
        return array(s);
      case CTRL:
      case INV:
        --i;
        return modified();
      default:
        throw new ParseException(t, ImmutableList.of("expression"), file);
    }
  }

  /** Parses a modified call, such as {@code ctrl inv RX(c, 0.5, t)}. */
  private Ast.Call modified() {
    final Span s = Span.of(peek().pos(file));
    final ImmutableList.Builder<Modifier> modifiers = ImmutableList.builder();
    for (;;) {
      if (accept(TokenKind.INV)) {
        modifiers.add(Modifier.INV);
      } else if (accept(TokenKind.CTRL)) {
        if (accept(TokenKind.LBRACKET)) {
          final Token n = expect(TokenKind.INT_LITERAL);
          final int count = (Integer) requireNonNull(n.value);
          if (count < 1) {
            throw new ParseException(n, ImmutableList.of("positive integer"),
                file);
          }
          expect(TokenKind.RBRACKET);
          modifiers.add(Modifier.ctrl(count));
        } else {
          modifiers.add(Modifier.CTRL);
        }
      } else {
        break;
      }
    }
    final Token start = peek();
    final Ast.Exp e = postfix();
    if (!(e instanceof Ast.Call)) {
      throw new ParseException(start, ImmutableList.of("call"), file);
    }
    final Ast.Call call = (Ast.Call) e;
    return ast.call(s.end(call), call.name,
        modifiers.addAll(call.modifiers).build(), call.args);
  }

  /** Parses a list or range, after the opening bracket. */
  private Ast.Exp array(Span s) {
    if (accept(TokenKind.RBRACKET)) {
      return ast.list(s.end(this), ImmutableList.of());
    }
    final Ast.Exp first = expression();
    if (accept(TokenKind.COLON)) {
      final Ast.Exp second = expression();
      if (accept(TokenKind.COLON)) {
        final Ast.Exp third = expression();
        expect(TokenKind.RBRACKET);
        return ast.range(s.end(this), first, second, third);
      }
      expect(TokenKind.RBRACKET);
      return ast.range(s.end(this), first, null, second);
    }
    final List<Ast.Exp> args = new ArrayList<>();
    args.add(first);
    while (accept(TokenKind.COMMA)) {
      args.add(expression());
    }
    expect(TokenKind.RBRACKET);
    return ast.list(s.end(this), args);
  }

  // token handling

  private Token peek() {
    return tokens.get(i);
  }

  private Token peekPastNewlines() {
    int j = i;
    while (tokens.get(j).kind == TokenKind.NEWLINE) {
      ++j;
    }
    return tokens.get(j);
  }

  private Token next() {
    final Token t = tokens.get(i);
    if (t.kind != TokenKind.EOF) {
      ++i;
    }
    return t;
  }

  private boolean accept(TokenKind kind) {
    if (peek().kind == kind) {
      next();
      return true;
    }
    return false;
  }

  private Token expect(TokenKind kind) {
    final Token t = peek();
    if (t.kind != kind) {
      throw new ParseException(t, ImmutableList.of(kind.describe()), file);
    }
    return next();
  }

  private void expectSeparator(String alternative) {
    final Token t = peek();
    if (t.kind != TokenKind.NEWLINE && t.kind != TokenKind.SEMICOLON) {
      throw new ParseException(t,
          ImmutableList.of(TokenKind.NEWLINE.describe(),
              TokenKind.SEMICOLON.describe(), alternative),
          file);
    }
  }

  private void skipSeparators() {
    while (peek().kind == TokenKind.NEWLINE
        || peek().kind == TokenKind.SEMICOLON) {
      next();
    }
  }

  private void skipNewlines() {
    while (peek().kind == TokenKind.NEWLINE) {
      next();
    }
  }
}

// End QuantaParser.java
