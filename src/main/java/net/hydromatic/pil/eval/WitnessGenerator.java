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
package net.hydromatic.pil.eval;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.pil.ast.Analyzed;
import net.hydromatic.pil.ast.Identity;
import net.hydromatic.pil.ast.Polynomial;
import net.hydromatic.pil.ast.PolynomialType;
import net.hydromatic.pil.ast.PublicDeclaration;
import net.hydromatic.pil.number.FieldElement;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Generates the values of the witness columns of a program, row by row.
 *
 * <p>Each row is derived from the previous one by repeated passes over the
 * identities and query columns, until a pass learns nothing new. The first
 * row is derived from the last row, whose values are not yet known, so
 * identities that refer to the next row usually only contribute from the
 * second row on. After the last row, identities that refer to the next row
 * are checked on the last and first rows.
 *
 * <p>A generator is single-use and not thread-safe.
 */
public class WitnessGenerator {
  private final Analyzed analyzed;
  private final FixedData fixedData;
  private final Map<Prop, Object> props;
  private final Tracer tracer;
  private final long degree;
  private final List<String> witnessNames;
  private final List<Identity> identities;
  private final IdentityProcessor identityProcessor;
  private final QueryProcessor queryProcessor;
  private final SimpleBitConstraintSet globalConstraints;
  private final Map<String, FieldElement> publics = new HashMap<>();
  private final List<FieldElement[]> rows = new ArrayList<>();

  /** Creates a witness generator.
   *
   * @param analyzed  Program
   * @param fixedData Values of the fixed columns
   * @param callback  Oracle for columns defined by a query
   * @param props     Properties; see {@link Prop}
   * @param tracer    Tracer
   */
  public WitnessGenerator(Analyzed analyzed, FixedData fixedData,
      QueryCallback callback, Map<Prop, Object> props, Tracer tracer) {
    this.analyzed = requireNonNull(analyzed);
    this.fixedData = requireNonNull(fixedData);
    this.props = ImmutableMap.copyOf(props);
    this.tracer = requireNonNull(tracer);
    final Integer degree = Prop.DEGREE.intValueOrNull(props);
    checkArgument(degree == null || degree == fixedData.degree,
        "degree %s does not match fixed data with %s rows", degree,
        fixedData.degree);
    this.degree = fixedData.degree;
    checkArgument(this.degree > 0, "degree must be positive");
    this.witnessNames = witnessNames(analyzed);
    this.identities = analyzed.identitiesInSourceOrder();
    this.identityProcessor = new IdentityProcessor(analyzed, fixedData,
        new IndexedFixedLookup(fixedData));
    this.queryProcessor = new QueryProcessor(analyzed, callback);
    this.globalConstraints = GlobalConstraints.determine(analyzed, fixedData);
  }

  /** Creates a witness generator, computing the fixed columns of the
   * program. The number of rows is property {@link Prop#DEGREE} if set,
   * otherwise the degree of the program. */
  public static WitnessGenerator create(Analyzed analyzed,
      QueryCallback callback, Map<Prop, Object> props, Tracer tracer) {
    final Integer degree = Prop.DEGREE.intValueOrNull(props);
    final Long programDegree = analyzed.degree();
    checkArgument(degree != null || programDegree != null,
        "program has no degree");
    final FixedData fixedData =
        ConstantEvaluator.generate(analyzed,
            degree != null ? degree : programDegree);
    return new WitnessGenerator(analyzed, fixedData, callback, props, tracer);
  }

  /** Names of the witness columns, indexed by column id. */
  private static List<String> witnessNames(Analyzed analyzed) {
    final String[] names = new String[Math.toIntExact(
        analyzed.commitmentCount())];
    for (Analyzed.Definition definition
        : analyzed.committedPolysInSourceOrder()) {
      final Polynomial poly = definition.poly;
      for (long offset = 0; offset < poly.columnCount(); offset++) {
        final long id = poly.id + offset;
        checkArgument(id < names.length && names[(int) id] == null,
            "invalid id %s for witness column %s", id,
            poly.columnName(offset));
        names[(int) id] = poly.columnName(offset);
      }
    }
    return ImmutableList.copyOf(names);
  }

  /** Generates every row and returns the witness columns, by name, in source
   * order.
   *
   * @throws EvalException if a row cannot be derived, or an identity does
   * not hold */
  public Map<String, List<FieldElement>> generate() {
    while (rows.size() < degree) {
      computeNextRow();
    }
    checkWrapAround();
    final Map<String, List<FieldElement>> columns = new LinkedHashMap<>();
    for (int id = 0; id < witnessNames.size(); id++) {
      final ImmutableList.Builder<FieldElement> b = ImmutableList.builder();
      for (FieldElement[] row : rows) {
        b.add(row[id]);
      }
      columns.put(witnessNames.get(id), b.build());
    }
    return columns;
  }

  /** Derives the next row, and returns its values.
   *
   * @throws EvalException with {@link EvalError#ROWS_EXHAUSTED} if every row
   * has been derived */
  public List<FieldElement> computeNextRow() {
    final long row = rows.size();
    if (row >= degree) {
      final EvalException e = new EvalException(EvalError.ROWS_EXHAUSTED);
      tracer.onError(row, e);
      throw e;
    }
    final @Nullable FieldElement[] current = row == 0
        ? new FieldElement[witnessNames.size()]
        : rows.get((int) row - 1);
    final RowPair rowPair = new RowPair(analyzed, fixedData, witnessNames,
        publics, row, current, globalConstraints);
    Outcome outcome = runPasses(rowPair);
    final Integer defaultValue = Prop.DEFAULT_VALUE.intValueOrNull(props);
    if (row == 0 && !rowPair.isComplete() && defaultValue != null) {
      for (int id = 0; id < witnessNames.size(); id++) {
        if (rowPair.nextValue(id) == null) {
          rowPair.setNext(id, FieldElement.of(defaultValue));
        }
      }
      outcome = runPasses(rowPair);
    }
    if (!outcome.errors.isEmpty()) {
      throw new EvalException(EvalError.multiple(outcome.errors));
    }
    if (outcome.progress || !rowPair.isComplete()) {
      // A row is accepted only after a pass that learns nothing
      IncompleteCause cause =
          IncompleteCause.of(IncompleteCause.Kind.NO_PROGRESS_TRANSFERRING);
      if (outcome.cause != null) {
        cause = cause.combine(outcome.cause);
      }
      final String reason = outcome.progress
          ? "did not converge after " + Prop.MAX_PASSES.intValue(props)
              + " passes"
          : "unknown columns " + rowPair.unknownColumns();
      final EvalException e =
          new EvalException(
              EvalError.generic("Could not derive row " + row + "; "
                  + reason + "; causes: " + cause));
      tracer.onError(row, e);
      throw e;
    }
    final FieldElement[] values = rowPair.nextRow();
    rows.add(values);
    recordPublics(row, values);
    tracer.onRowComplete(row);
    return ImmutableList.copyOf(values);
  }

  /** Runs passes over the identities and query columns until a pass makes no
   * progress, or the maximum number of passes is reached. In the latter case
   * the returned outcome still has {@code progress} set. */
  private Outcome runPasses(RowPair rowPair) {
    final int maxPasses = Prop.MAX_PASSES.intValue(props);
    final boolean tracePasses = Prop.TRACE_PASSES.booleanValue(props);
    Outcome outcome = new Outcome();
    for (int pass = 0; pass < maxPasses; pass++) {
      outcome = new Outcome();
      for (Identity identity : identities) {
        try {
          final EvalValue value = identityProcessor.process(identity, rowPair);
          tracer.onIdentity(rowPair.row, identity, value);
          outcome.add(value, rowPair.apply(value));
        } catch (EvalException e) {
          outcome.fail(rowPair.row, e);
        }
      }
      for (Analyzed.Definition column : queryProcessor.columns()) {
        try {
          final EvalValue value = queryProcessor.process(column, rowPair);
          tracer.onQuery(rowPair.row, column.poly.absoluteName, value);
          outcome.add(value, rowPair.apply(value));
        } catch (EvalException e) {
          outcome.fail(rowPair.row, e);
        }
      }
      if (tracePasses) {
        tracer.onPass(rowPair.row, pass, outcome.progress);
      }
      if (!outcome.progress) {
        break;
      }
    }
    return outcome;
  }

  /** Checks identities that refer to the next row on the last row, whose
   * next row is the first row. */
  private void checkWrapAround() {
    final RowPair rowPair = new RowPair(analyzed, fixedData, witnessNames,
        publics, degree, rows.get(rows.size() - 1), globalConstraints);
    final FieldElement[] first = rows.get(0);
    for (int id = 0; id < first.length; id++) {
      rowPair.setNext(id, first[id]);
    }
    for (Identity identity : identities) {
      if (identity.containsNextReference(analyzed)) {
        try {
          identityProcessor.process(identity, rowPair);
        } catch (EvalException e) {
          tracer.onError(degree, e);
          throw e;
        }
      }
    }
  }

  /** Returns the values of the public declarations whose row has been
   * derived so far. */
  public Map<String, FieldElement> publics() {
    return ImmutableMap.copyOf(publics);
  }

  /** Records the values of public declarations that refer to a row. */
  private void recordPublics(long row, FieldElement[] values) {
    for (PublicDeclaration declaration
        : analyzed.publicDeclarationsInSourceOrder()) {
      if (declaration.index != row) {
        continue;
      }
      final Polynomial poly =
          analyzed.definition(declaration.polynomial.name).poly;
      final long offset = declaration.polynomial.offset();
      if (poly.polyType == PolynomialType.COMMITTED) {
        publics.put(declaration.name,
            values[Math.toIntExact(poly.id + offset)]);
      } else if (poly.polyType == PolynomialType.CONSTANT) {
        publics.put(declaration.name,
            fixedData.value(poly.columnName(offset), row));
      }
    }
  }

  /** What one pass over a row learned. */
  private class Outcome {
    boolean progress;
    @Nullable IncompleteCause cause;
    final List<EvalError> errors = new ArrayList<>();

    void add(EvalValue value, boolean progress) {
      this.progress |= progress;
      if (!value.isComplete()) {
        final IncompleteCause c = value.status().cause();
        cause = cause == null ? c : cause.combine(c);
      }
    }

    /** Records an error; rethrows it if it is fatal. */
    void fail(long row, EvalException e) {
      tracer.onError(row, e);
      if (e.isFatal()) {
        throw e;
      }
      errors.add(e.error);
    }
  }
}

// End WitnessGenerator.java
