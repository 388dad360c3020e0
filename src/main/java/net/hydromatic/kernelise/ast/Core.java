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
package net.hydromatic.kernelise.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.kernelise.type.ArrayType;
import net.hydromatic.kernelise.type.PrimitiveType;
import net.hydromatic.kernelise.type.Type;
import net.hydromatic.kernelise.type.Types;

/**
 * Intermediate representation.
 *
 * <p>This class functions as a namespace, so that we can keep the class names
 * short. Nodes are immutable; create them via {@link CoreBuilder#core}.
 *
 * <p>The same node classes describe the program before and after
 * sequentialization. Before, a body may contain combinators ({@link Map},
 * {@link Redomap}, {@link Scan}, {@link Filter}, {@link Stream}); after, it
 * contains none, but may contain {@link GroupStream}.
 */
public class Core {
  private Core() {}

  /** Ordered list of bounds-check obligations.
   *
   * <p>Opaque to sequentialization, except that they are copied onto the
   * index and update statements that it creates. */
  public static class Certificates {
    public static final Certificates EMPTY =
        new Certificates(ImmutableList.of());

    public final ImmutableList<Name> names;

    Certificates(ImmutableList<Name> names) {
      this.names = requireNonNull(names);
    }

    public boolean isEmpty() {
      return names.isEmpty();
    }

    @Override
    public int hashCode() {
      return names.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Certificates
          && names.equals(((Certificates) o).names);
    }

    @Override
    public String toString() {
      return names.isEmpty() ? "" : "<" + names + ">";
    }
  }

  // atoms

  /** Sub-expression: an atomic operand, either a variable or a constant. */
  public abstract static class SubExp extends CoreNode {
    SubExp(Op op) {
      super(op);
    }

    /** Returns the type. */
    public abstract Type type();
  }

  /** Binder of a variable: a name and its type.
   *
   * <p>Parameters of lambdas, loops and grouped streams are params; so are the
   * elements of a {@link Pattern}. */
  public static class Param extends CoreNode {
    public final Name name;
    public final Type type;

    Param(Name name, Type type) {
      super(Op.PARAM);
      this.name = requireNonNull(name);
      this.type = requireNonNull(type);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Param
          && name.equals(((Param) o).name)
          && type.equals(((Param) o).type);
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return w.append(name).append(": ").append(type);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /** Returns a param with the same name and a different type. */
    public Param withType(Type type) {
      return type.equals(this.type) ? this : new Param(name, type);
    }
  }

  /** Reference to a variable. */
  public static class Var extends SubExp {
    public final Param param;

    Var(Param param) {
      super(Op.VAR);
      this.param = requireNonNull(param);
    }

    /** Returns the name of the referenced variable. */
    public Name name() {
      return param.name;
    }

    @Override
    public Type type() {
      return param.type;
    }

    @Override
    public int hashCode() {
      return param.name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Var
          && param.name.equals(((Var) o).param.name);
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return w.append(param.name);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Constant of a primitive type. */
  public static class Constant extends SubExp {
    public final PrimitiveType type;
    public final Object value;

    Constant(PrimitiveType type, Object value) {
      super(Op.CONSTANT);
      this.type = requireNonNull(type);
      this.value = requireNonNull(value);
      checkArgument(type.isValid(value), "invalid value %s for type %s",
          value, type);
    }

    @Override
    public PrimitiveType type() {
      return type;
    }

    @Override
    public int hashCode() {
      return Objects.hash(type, value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Constant
          && type == ((Constant) o).type
          && value.equals(((Constant) o).value);
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return type == PrimitiveType.BOOL
          ? w.append(value)
          : w.append(value).append(type.moniker);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Existential dimension of a lambda's return type; its size is known only
   * when the lambda has been evaluated. */
  public static class Ext extends SubExp {
    public final int i;

    Ext(int i) {
      super(Op.EXT);
      this.i = i;
    }

    @Override
    public Type type() {
      return PrimitiveType.I32;
    }

    @Override
    public int hashCode() {
      return i;
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Ext && i == ((Ext) o).i;
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return w.append("?").append(i);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  // slices

  /** One dimension of a slice. */
  public abstract static class DimIndex extends CoreNode {
    DimIndex(Op op) {
      super(op);
    }
  }

  /** Dimension of a slice that selects a single row. */
  public static class DimFix extends DimIndex {
    public final SubExp i;

    DimFix(SubExp i) {
      super(Op.DIM_FIX);
      this.i = requireNonNull(i);
    }

    @Override
    public int hashCode() {
      return i.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof DimFix && i.equals(((DimFix) o).i);
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return w.append(i);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Dimension of a slice that selects {@code num} rows, starting at
   * {@code offset}, {@code stride} apart. */
  public static class DimSlice extends DimIndex {
    public final SubExp offset;
    public final SubExp num;
    public final SubExp stride;

    DimSlice(SubExp offset, SubExp num, SubExp stride) {
      super(Op.DIM_SLICE);
      this.offset = requireNonNull(offset);
      this.num = requireNonNull(num);
      this.stride = requireNonNull(stride);
    }

    @Override
    public int hashCode() {
      return Objects.hash(offset, num, stride);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof DimSlice
          && offset.equals(((DimSlice) o).offset)
          && num.equals(((DimSlice) o).num)
          && stride.equals(((DimSlice) o).stride);
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return w.append(offset).append(":+").append(num).append("*")
          .append(stride);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  // patterns

  /** How a pattern element is bound. */
  public abstract static class Bindage extends CoreNode {
    Bindage(Op op) {
      super(op);
    }
  }

  /** The element is a fresh variable. */
  public static class BindVar extends Bindage {
    static final BindVar INSTANCE = new BindVar();

    private BindVar() {
      super(Op.BIND_VAR);
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return w;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** The element is {@code source} with the value written, in place, at
   * {@code slice}. Consumes {@code source}. */
  public static class BindInPlace extends Bindage {
    public final Certificates certificates;
    public final Var source;
    public final ImmutableList<DimIndex> slice;

    BindInPlace(Certificates certificates, Var source,
        ImmutableList<DimIndex> slice) {
      super(Op.BIND_IN_PLACE);
      this.certificates = requireNonNull(certificates);
      this.source = requireNonNull(source);
      this.slice = requireNonNull(slice);
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return w.append(" <- ").append(certificates).append(source)
          .list(" with [", slice, "]");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Element of a pattern. */
  public static class PatElem extends CoreNode {
    public final Param param;
    public final Bindage bindage;

    PatElem(Param param, Bindage bindage) {
      super(Op.PAT_ELEM);
      this.param = requireNonNull(param);
      this.bindage = requireNonNull(bindage);
    }

    public Name name() {
      return param.name;
    }

    public Type type() {
      return param.type;
    }

    /** Returns whether this element overwrites an existing array. */
    public boolean isInPlace() {
      return bindage instanceof BindInPlace;
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return w.append(param).append(bindage);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Left-hand side of a statement. */
  public static class Pattern extends CoreNode {
    public final ImmutableList<PatElem> elements;

    Pattern(ImmutableList<PatElem> elements) {
      super(Op.PATTERN);
      this.elements = requireNonNull(elements);
    }

    public int size() {
      return elements.size();
    }

    /** Returns the names bound by this pattern. */
    public List<Name> names() {
      return elements.stream().map(PatElem::name)
          .collect(ImmutableList.toImmutableList());
    }

    /** Returns the types of the elements of this pattern. */
    public List<Type> types() {
      return elements.stream().map(PatElem::type)
          .collect(ImmutableList.toImmutableList());
    }

    @Override
    public int hashCode() {
      return elements.stream().map(PatElem::name)
          .collect(ImmutableList.toImmutableList()).hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Pattern
          && names().equals(((Pattern) o).names())
          && types().equals(((Pattern) o).types());
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return w.list("{", elements, "}");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  // statements and bodies

  /** Statement; binds a pattern to the result of an expression. */
  public static class Stm extends CoreNode {
    public final Pattern pattern;
    public final Exp exp;

    Stm(Pattern pattern, Exp exp) {
      super(Op.STM);
      this.pattern = requireNonNull(pattern);
      this.exp = requireNonNull(exp);
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return w.append("let ").append(pattern).append(" = ").append(exp);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Sequence of statements followed by a list of results. */
  public static class Body extends CoreNode {
    public final ImmutableList<Stm> stms;
    public final ImmutableList<SubExp> result;

    Body(ImmutableList<Stm> stms, ImmutableList<SubExp> result) {
      super(Op.BODY);
      this.stms = requireNonNull(stms);
      this.result = requireNonNull(result);
    }

    /** Returns the types of the results. */
    public List<Type> resultTypes() {
      return result.stream().map(SubExp::type)
          .collect(ImmutableList.toImmutableList());
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      w.append("{");
      stms.forEach(stm -> w.append(stm).append("; "));
      return w.list("in {", result, "}}");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /** Creates a copy of this {@code Body} with given contents,
     * or {@code this} if the contents are the same. */
    public Body copy(List<Stm> stms, List<? extends SubExp> result) {
      return stms.equals(this.stms) && result.equals(this.result)
          ? this
          : new Body(ImmutableList.copyOf(stms), ImmutableList.copyOf(result));
    }
  }

  /** Anonymous function, the argument to a combinator. */
  public static class Lambda extends CoreNode {
    public final ImmutableList<Param> params;
    public final Body body;
    public final ImmutableList<Type> returnTypes;

    Lambda(ImmutableList<Param> params, Body body,
        ImmutableList<Type> returnTypes) {
      super(Op.LAMBDA);
      this.params = requireNonNull(params);
      this.body = requireNonNull(body);
      this.returnTypes = requireNonNull(returnTypes);
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return w.list("fn {", params, "}").list(": {", returnTypes, "} => ")
          .append(body);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /** Creates a copy of this {@code Lambda} with a given body. */
    public Lambda copy(List<Param> params, Body body) {
      return params.equals(this.params) && body == this.body
          ? this
          : new Lambda(ImmutableList.copyOf(params), body, returnTypes);
    }
  }

  // expressions

  /** Right-hand side of a statement. */
  public abstract static class Exp extends CoreNode {
    Exp(Op op) {
      super(op);
      checkArgument(op.isExp());
    }

    /** Returns the types of the values that this expression produces,
     * one per pattern element. */
    public abstract List<Type> types();
  }

  /** Expression that is just a sub-expression; for example
   * {@code let x = y}. */
  public static class SubExpOp extends Exp {
    public final SubExp subExp;

    SubExpOp(SubExp subExp) {
      super(Op.SUB_EXP);
      this.subExp = requireNonNull(subExp);
    }

    @Override
    public List<Type> types() {
      return ImmutableList.of(subExp.type());
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return w.append(subExp);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Copy of an array. The result is unique. */
  public static class Copy extends Exp {
    public final Var array;

    Copy(Var array) {
      super(Op.COPY);
      this.array = requireNonNull(array);
    }

    @Override
    public List<Type> types() {
      return ImmutableList.of(array.type().withUniqueness(true));
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return w.append("copy(").append(array).append(")");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Read of an element, row or slice of an array. */
  public static class Index extends Exp {
    public final Certificates certificates;
    public final Var array;
    public final ImmutableList<DimIndex> slice;

    Index(Certificates certificates, Var array,
        ImmutableList<DimIndex> slice) {
      super(Op.INDEX);
      this.certificates = requireNonNull(certificates);
      this.array = requireNonNull(array);
      this.slice = requireNonNull(slice);
      checkArgument(slice.size() <= array.type().rank(),
          "slice %s has more dimensions than %s", slice, array.type());
    }

    @Override
    public List<Type> types() {
      return ImmutableList.of(Types.sliceType(array.type(), slice));
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return w.append(certificates).append(array).list("[", slice, "]");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** New, uninitialized, unique array. */
  public static class Scratch extends Exp {
    public final PrimitiveType elementType;
    public final ImmutableList<SubExp> dims;

    Scratch(PrimitiveType elementType, ImmutableList<SubExp> dims) {
      super(Op.SCRATCH);
      this.elementType = requireNonNull(elementType);
      this.dims = requireNonNull(dims);
      checkArgument(!dims.isEmpty(), "scratch needs a dimension");
    }

    @Override
    public List<Type> types() {
      return ImmutableList.of(ArrayType.of(elementType, dims, true));
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return w.append("scratch(").append(elementType)
          .list(", ", dims, ")");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Application of a binary operator to two scalars. */
  public static class BinOp extends Exp {
    public final BinaryOp binaryOp;
    public final SubExp x;
    public final SubExp y;

    BinOp(BinaryOp binaryOp, SubExp x, SubExp y) {
      super(Op.BIN_OP);
      this.binaryOp = requireNonNull(binaryOp);
      this.x = requireNonNull(x);
      this.y = requireNonNull(y);
    }

    @Override
    public List<Type> types() {
      return ImmutableList.of(x.type());
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return w.append("(").append(x).append(" ").append(binaryOp.symbol)
          .append(" ").append(y).append(")");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Comparison of two scalars. */
  public static class CmpOp extends Exp {
    public final CompareOp compareOp;
    public final SubExp x;
    public final SubExp y;

    CmpOp(CompareOp compareOp, SubExp x, SubExp y) {
      super(Op.CMP_OP);
      this.compareOp = requireNonNull(compareOp);
      this.x = requireNonNull(x);
      this.y = requireNonNull(y);
    }

    @Override
    public List<Type> types() {
      return ImmutableList.of(PrimitiveType.BOOL);
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return w.append("(").append(x).append(" ").append(compareOp.symbol)
          .append(" ").append(y).append(")");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** The array {@code [0, 1, ..., n - 1]}. */
  public static class Iota extends Exp {
    public final SubExp n;

    Iota(SubExp n) {
      super(Op.IOTA);
      this.n = requireNonNull(n);
    }

    @Override
    public List<Type> types() {
      return ImmutableList.of(
          ArrayType.of(PrimitiveType.I32, ImmutableList.of(n), true));
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return w.append("iota(").append(n).append(")");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** An array of {@code n} copies of a value. */
  public static class Replicate extends Exp {
    public final SubExp n;
    public final SubExp value;

    Replicate(SubExp n, SubExp value) {
      super(Op.REPLICATE);
      this.n = requireNonNull(n);
      this.value = requireNonNull(value);
    }

    @Override
    public List<Type> types() {
      return ImmutableList.of(value.type().arrayOfRow(n).withUniqueness(true));
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return w.append("replicate(").append(n).append(", ").append(value)
          .append(")");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Conditional. */
  public static class If extends Exp {
    public final SubExp condition;
    public final Body ifTrue;
    public final Body ifFalse;
    public final ImmutableList<Type> returnTypes;

    If(SubExp condition, Body ifTrue, Body ifFalse,
        ImmutableList<Type> returnTypes) {
      super(Op.IF);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
      this.returnTypes = requireNonNull(returnTypes);
    }

    @Override
    public List<Type> types() {
      return returnTypes;
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return w.append("if ").append(condition).append(" then ")
          .append(ifTrue).append(" else ").append(ifFalse)
          .list(": {", returnTypes, "}");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /** Creates a copy of this {@code If} with given branches,
     * or {@code this} if the branches are the same. */
    public If copy(Body ifTrue, Body ifFalse) {
      return ifTrue == this.ifTrue && ifFalse == this.ifFalse
          ? this
          : new If(condition, ifTrue, ifFalse, returnTypes);
    }
  }

  /** Loop-carried variable and its initial value. */
  public static class Merge extends CoreNode {
    public final Param param;
    public final SubExp init;

    Merge(Param param, SubExp init) {
      super(Op.MERGE);
      this.param = requireNonNull(param);
      this.init = requireNonNull(init);
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return w.append(param).append(" = ").append(init);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** How a {@link DoLoop} decides how many times to iterate. */
  public abstract static class LoopForm extends CoreNode {
    LoopForm(Op op) {
      super(op);
    }
  }

  /** Loop form that runs an induction variable from 0 to {@code bound}. */
  public static class ForLoop extends LoopForm {
    public final Param i;
    public final SubExp bound;

    ForLoop(Param i, SubExp bound) {
      super(Op.FOR_LOOP);
      this.i = requireNonNull(i);
      this.bound = requireNonNull(bound);
      checkArgument(i.type.elementType().isInteger() && i.type.rank() == 0,
          "induction variable must be integer: %s", i);
    }

    /** Returns the integer type of the induction variable. */
    public PrimitiveType intType() {
      return i.type.elementType();
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return w.append("for ").append(i.name).append(":")
          .append(intType()).append(" < ").append(bound);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Loop form that runs while a boolean merge variable is true. */
  public static class WhileLoop extends LoopForm {
    public final Name condition;

    WhileLoop(Name condition) {
      super(Op.WHILE_LOOP);
      this.condition = requireNonNull(condition);
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return w.append("while ").append(condition);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Sequential loop with loop-carried ("merge") variables.
   *
   * <p>The body's results become the merge variables' values for the next
   * iteration; the final values are the loop's results. */
  public static class DoLoop extends Exp {
    public final ImmutableList<Merge> merge;
    public final LoopForm form;
    public final Body body;

    DoLoop(ImmutableList<Merge> merge, LoopForm form, Body body) {
      super(Op.DO_LOOP);
      this.merge = requireNonNull(merge);
      this.form = requireNonNull(form);
      this.body = requireNonNull(body);
    }

    /** Returns the merge parameters. */
    public List<Param> params() {
      return merge.stream().map(m -> m.param)
          .collect(ImmutableList.toImmutableList());
    }

    /** Returns the initial values of the merge parameters. */
    public List<SubExp> inits() {
      return merge.stream().map(m -> m.init)
          .collect(ImmutableList.toImmutableList());
    }

    @Override
    public List<Type> types() {
      return merge.stream().map(m -> m.param.type)
          .collect(ImmutableList.toImmutableList());
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return w.list("loop {", merge, "} ").append(form).append(" do ")
          .append(body);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /** Creates a copy of this {@code DoLoop} with a given body. */
    public DoLoop copy(Body body) {
      return body == this.body ? this : new DoLoop(merge, form, body);
    }
  }

  // combinators

  /** Second-order array combinator. */
  public abstract static class Soac extends Exp {
    public final Certificates certificates;
    /** Length of the outer dimension of the arrays. */
    public final SubExp width;
    public final ImmutableList<Var> arrays;

    Soac(Op op, Certificates certificates, SubExp width,
        ImmutableList<Var> arrays) {
      super(op);
      this.certificates = requireNonNull(certificates);
      this.width = requireNonNull(width);
      this.arrays = requireNonNull(arrays);
      checkArgument(op.isSoac());
    }

    /** Returns the lambdas that this combinator applies. */
    public abstract List<Lambda> lambdas();

    CoreWriter unparse(CoreWriter w, String name, List<?> args) {
      w.append(name).append("(").append(certificates).append(width);
      args.forEach(arg -> {
        w.append(", ");
        if (arg instanceof CoreNode) {
          w.append((CoreNode) arg);
        } else {
          w.list("{", (List<?>) arg, "}");
        }
      });
      return w.list(", {", arrays, "})");
    }
  }

  /** Element-wise application of a lambda. */
  public static class Map extends Soac {
    public final Lambda lambda;

    Map(Certificates certificates, SubExp width, Lambda lambda,
        ImmutableList<Var> arrays) {
      super(Op.MAP, certificates, width, arrays);
      this.lambda = requireNonNull(lambda);
    }

    @Override
    public List<Lambda> lambdas() {
      return ImmutableList.of(lambda);
    }

    @Override
    public List<Type> types() {
      return lambda.returnTypes.stream().map(t -> (Type) t.arrayOfRow(width))
          .collect(ImmutableList.toImmutableList());
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return unparse(w, "map", ImmutableList.of(lambda));
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Whether a reduction operator is commutative. */
  public enum Commutativity {
    COMMUTATIVE, NONCOMMUTATIVE
  }

  /** Fused reduction and map.
   *
   * <p>The fold lambda takes the accumulators followed by one element of each
   * array, and returns the new accumulators followed by "map-out" values,
   * which are collected into arrays. The reduce lambda combines
   * accumulators; a sequential implementation does not need it. */
  public static class Redomap extends Soac {
    public final Commutativity commutativity;
    public final Lambda reduceLambda;
    public final Lambda foldLambda;
    public final ImmutableList<SubExp> neutral;

    Redomap(Certificates certificates, SubExp width,
        Commutativity commutativity, Lambda reduceLambda, Lambda foldLambda,
        ImmutableList<SubExp> neutral, ImmutableList<Var> arrays) {
      super(Op.REDOMAP, certificates, width, arrays);
      this.commutativity = requireNonNull(commutativity);
      this.reduceLambda = requireNonNull(reduceLambda);
      this.foldLambda = requireNonNull(foldLambda);
      this.neutral = requireNonNull(neutral);
    }

    @Override
    public List<Lambda> lambdas() {
      return ImmutableList.of(reduceLambda, foldLambda);
    }

    @Override
    public List<Type> types() {
      final ImmutableList.Builder<Type> b = ImmutableList.builder();
      neutral.forEach(n -> b.add(n.type()));
      foldLambda.returnTypes.subList(neutral.size(),
          foldLambda.returnTypes.size())
          .forEach(t -> b.add(t.arrayOfRow(width)));
      return b.build();
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return unparse(w, "redomap",
          ImmutableList.of(reduceLambda, foldLambda, neutral));
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Inclusive prefix scan. */
  public static class Scan extends Soac {
    public final Lambda lambda;
    public final ImmutableList<SubExp> neutral;

    Scan(Certificates certificates, SubExp width, Lambda lambda,
        ImmutableList<SubExp> neutral, ImmutableList<Var> arrays) {
      super(Op.SCAN, certificates, width, arrays);
      this.lambda = requireNonNull(lambda);
      this.neutral = requireNonNull(neutral);
    }

    @Override
    public List<Lambda> lambdas() {
      return ImmutableList.of(lambda);
    }

    @Override
    public List<Type> types() {
      return neutral.stream().map(n -> (Type) n.type().arrayOfRow(width))
          .collect(ImmutableList.toImmutableList());
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return unparse(w, "scan", ImmutableList.of(lambda, neutral));
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Keeps the elements of an array for which a predicate holds.
   *
   * <p>Binds two values: the number of elements kept, and an array of that
   * length. */
  public static class Filter extends Soac {
    public final Lambda lambda;

    Filter(Certificates certificates, SubExp width, Lambda lambda,
        ImmutableList<Var> arrays) {
      super(Op.FILTER, certificates, width, arrays);
      this.lambda = requireNonNull(lambda);
      checkArgument(arrays.size() == 1, "filter takes one array");
    }

    @Override
    public List<Lambda> lambdas() {
      return ImmutableList.of(lambda);
    }

    @Override
    public List<Type> types() {
      return ImmutableList.of(PrimitiveType.I32,
          arrays.get(0).type().setOuterSize(new Ext(0)));
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return unparse(w, "filter", ImmutableList.of(lambda));
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** How a {@link Stream} is evaluated. */
  public abstract static class StreamForm extends CoreNode {
    public final ImmutableList<SubExp> accumulators;

    StreamForm(Op op, ImmutableList<SubExp> accumulators) {
      super(op);
      this.accumulators = requireNonNull(accumulators);
    }
  }

  /** Stream form in which chunks are processed in order, one at a time,
   * threading the accumulators. */
  public static class Sequential extends StreamForm {
    Sequential(ImmutableList<SubExp> accumulators) {
      super(Op.SEQUENTIAL, accumulators);
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return w.list("sequential {", accumulators, "}");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Stream form in which chunks may be processed in parallel; each starts
   * with the accumulators, and their results are combined by a reduce
   * lambda. */
  public static class Parallel extends StreamForm {
    public final Commutativity commutativity;
    public final Lambda reduceLambda;

    Parallel(Commutativity commutativity, Lambda reduceLambda,
        ImmutableList<SubExp> accumulators) {
      super(Op.PARALLEL, accumulators);
      this.commutativity = requireNonNull(commutativity);
      this.reduceLambda = requireNonNull(reduceLambda);
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return w.append("parallel ").append(reduceLambda)
          .list(" {", accumulators, "}");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Streaming fold.
   *
   * <p>The lambda's parameters are the chunk size, then the accumulators,
   * then one chunk of each array. It returns the new accumulators followed by
   * "map-out" chunks, which are concatenated into arrays. */
  public static class Stream extends Soac {
    public final StreamForm form;
    public final Lambda lambda;

    Stream(Certificates certificates, SubExp width, StreamForm form,
        Lambda lambda, ImmutableList<Var> arrays) {
      super(Op.STREAM, certificates, width, arrays);
      this.form = requireNonNull(form);
      this.lambda = requireNonNull(lambda);
    }

    @Override
    public List<Lambda> lambdas() {
      return form instanceof Parallel
          ? ImmutableList.of(((Parallel) form).reduceLambda, lambda)
          : ImmutableList.of(lambda);
    }

    @Override
    public List<Type> types() {
      final int accCount = form.accumulators.size();
      final ImmutableList.Builder<Type> b = ImmutableList.builder();
      form.accumulators.forEach(a -> b.add(a.type()));
      lambda.returnTypes.subList(accCount, lambda.returnTypes.size())
          .forEach(t -> b.add(t.setOuterSize(width)));
      return b.build();
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return unparse(w, "stream", ImmutableList.of(form, lambda));
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  // kernel constructs

  /** Body and parameters of a {@link GroupStream}. */
  public static class GroupStreamLambda extends CoreNode {
    public final Param chunkSize;
    public final Param chunkOffset;
    public final ImmutableList<Param> accParams;
    public final ImmutableList<Param> arrParams;
    public final Body body;

    GroupStreamLambda(Param chunkSize, Param chunkOffset,
        ImmutableList<Param> accParams, ImmutableList<Param> arrParams,
        Body body) {
      super(Op.GROUP_STREAM_LAMBDA);
      this.chunkSize = requireNonNull(chunkSize);
      this.chunkOffset = requireNonNull(chunkOffset);
      this.accParams = requireNonNull(accParams);
      this.arrParams = requireNonNull(arrParams);
      this.body = requireNonNull(body);
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return w.append("fn ").append(chunkSize.name).append(" ")
          .append(chunkOffset.name).list(" {", accParams, "}")
          .list(" {", arrParams, "} => ").append(body);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Chunked sequential loop that runs inside one parallel worker.
   *
   * <p>Iterates over {@code [0, width)} in chunks of at most
   * {@code maxChunk} elements. Each iteration binds the chunk size, the
   * offset of the chunk, the accumulators, and, for each array, the window
   * of the array that the chunk covers. The body returns the new
   * accumulators. If {@code maxChunk} is the constant 1, every chunk has one
   * element; if it is the width, the backend chooses. */
  public static class GroupStream extends Exp {
    public final SubExp width;
    public final SubExp maxChunk;
    public final GroupStreamLambda lambda;
    public final ImmutableList<SubExp> accumulators;
    public final ImmutableList<Var> arrays;

    GroupStream(SubExp width, SubExp maxChunk, GroupStreamLambda lambda,
        ImmutableList<SubExp> accumulators, ImmutableList<Var> arrays) {
      super(Op.GROUP_STREAM);
      this.width = requireNonNull(width);
      this.maxChunk = requireNonNull(maxChunk);
      this.lambda = requireNonNull(lambda);
      this.accumulators = requireNonNull(accumulators);
      this.arrays = requireNonNull(arrays);
      checkArgument(lambda.accParams.size() == accumulators.size(),
          "%s accumulator params but %s accumulators",
          lambda.accParams.size(), accumulators.size());
      checkArgument(lambda.body.result.size() == accumulators.size(),
          "body returns %s results but there are %s accumulators",
          lambda.body.result.size(), accumulators.size());
      checkArgument(lambda.arrParams.size() == arrays.size(),
          "%s array params but %s arrays",
          lambda.arrParams.size(), arrays.size());
    }

    @Override
    public List<Type> types() {
      return lambda.accParams.stream().map(p -> p.type)
          .collect(ImmutableList.toImmutableList());
    }

    @Override
    CoreWriter unparse(CoreWriter w) {
      return w.append("group_stream(").append(width).append(", ")
          .append(maxChunk).append(", ").append(lambda)
          .list(", {", accumulators, "}").list(", {", arrays, "})");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }
}

// End Core.java
