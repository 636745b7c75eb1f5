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
package net.hydromatic.focus.synth;

import static net.hydromatic.focus.ast.CoreBuilder.core;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.focus.ast.Core;
import net.hydromatic.focus.ast.Replacer;
import net.hydromatic.focus.eval.AngelicEvaluator;
import net.hydromatic.focus.eval.EvalEnv;
import net.hydromatic.focus.eval.EvalEnvs;
import net.hydromatic.focus.eval.EvalResult;
import net.hydromatic.focus.eval.Evaluator;
import net.hydromatic.focus.eval.Prop;
import net.hydromatic.focus.type.PrimitiveType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Rule that narrows a repair problem to the part of its guide that the
 * failing examples exercise.
 *
 * <p>The guide marks the sub-expression of the function suspected to be
 * wrong. Depending on the guide's shape, the rule:
 *
 * <ul>
 *   <li>for "if", either focuses on the condition (if negating it fixes every
 *       failing example), on one branch (if every failing example takes that
 *       branch), or splits into two problems, one per branch;
 *   <li>for "case", creates one problem per case that some failing example
 *       reaches, plus one for a new wildcard case if some failing example
 *       matches none of the cases;
 *   <li>for "let", focuses on the body, adding the bound variable to the
 *       inputs.
 * </ul>
 *
 * <p>The rule only applies at the root of the search, or directly below a
 * node that it created itself.
 */
public class FocusRule implements Rule {
  public static final FocusRule INSTANCE = new FocusRule();

  private FocusRule() {}

  @Override
  public String name() {
    return "Focus";
  }

  @Override
  public List<RuleInstantiation> instantiateOn(SearchContext context,
      Problem problem) {
    final SearchNode parentNode = context.parentNode;
    if (parentNode != null
        && !(parentNode instanceof SearchNode.AndNode
            && ((SearchNode.AndNode) parentNode).instantiation.rule
                == this)) {
      context.tracer.onReentryRejected(problem, parentNode);
      return ImmutableList.of();
    }

    final List<Core.Exp> guides = new ArrayList<>();
    final List<Witnesses.Witness> others = new ArrayList<>();
    for (Witnesses.Witness witness : problem.witnesses) {
      if (witness instanceof Witnesses.Guide) {
        guides.add(witness.exp);
      } else {
        others.add(witness);
      }
    }

    final Focuser focuser = new Focuser(context, problem, others);
    final ImmutableList.Builder<RuleInstantiation> b = ImmutableList.builder();
    for (Core.Exp guide : guides) {
      final RuleInstantiation instantiation =
          focuser.focus(GuideShape.of(guide));
      if (instantiation != null) {
        context.tracer.onInstantiation(instantiation);
        b.add(instantiation);
      }
    }
    return b.build();
  }

  /** Returns an expression that is true if a function's result satisfies
   * its postcondition: "let val res = body in post res end".
   *
   * <p>If the function has no postcondition, the expression is
   * {@code true}. */
  public static Core.Exp functionSpec(Core.FunDef funDef,
      NameGenerator nameGenerator) {
    final Core.IdPat res = nameGenerator.fresh(funDef.returnType, "res");
    final Core.Exp post = funDef.post == null
        ? core.boolLiteral(true)
        : core.apply(funDef.post, core.id(res));
    return core.let(res, funDef.body, post);
  }

  /** Applies the rule to the guides of one problem. */
  private class Focuser {
    final SearchContext context;
    final Problem problem;
    final ImmutableList<Witnesses.Witness> others;
    final Evaluator evaluator;
    final ConditionClassifier classifier;

    Focuser(SearchContext context, Problem problem,
        List<Witnesses.Witness> others) {
      this.context = context;
      this.problem = problem;
      this.others = ImmutableList.copyOf(others);
      this.evaluator = context.evaluator();
      this.classifier = ConditionClassifier.of(problem, context.tracer);
    }

    /** Returns the witnesses for a sub-problem that focuses on
     * {@code guide}. */
    List<Witnesses.Witness> witnesses(Core.Exp guide) {
      return ImmutableList.<Witnesses.Witness>builder()
          .add(Witnesses.guide(guide)).addAll(others).build();
    }

    @Nullable RuleInstantiation focus(GuideShape shape) {
      switch (shape.kind) {
      case CONDITIONAL:
        return focusConditional((GuideShape.Conditional) shape);
      case PATTERN_MATCH:
        return focusMatch((GuideShape.PatternMatch) shape);
      case BINDING:
        return focusLet((GuideShape.Binding) shape);
      default:
        return null;
      }
    }

    /** Returns the examples whose inputs make {@code condition} true. */
    ExampleBank filterIns(Core.Exp condition) {
      return problem.examples.filterIns(ins ->
          Boolean.TRUE.equals(
              evaluator.eval(condition, env(problem.inputs, ins))
                  .booleanValue()));
    }

    EvalEnv env(List<Core.IdPat> inputs, List<Object> ins) {
      return EvalEnvs.of(inputs, ins);
    }

    /** Returns a row extended with the values of some expressions, or an
     * empty list if any of them fails to evaluate. */
    List<List<Object>> extend(List<Object> ins, List<Core.Exp> exps) {
      final EvalEnv env = env(problem.inputs, ins);
      final List<Object> row = new ArrayList<>(ins);
      for (Core.Exp exp : exps) {
        final EvalResult result = evaluator.eval(exp, env);
        if (!result.isSuccess()) {
          context.tracer.onEvalFailure(exp, ins, (EvalResult.Failure) result);
          return ImmutableList.of();
        }
        row.add(((EvalResult.Success) result).value);
      }
      return ImmutableList.of(row);
    }

    RuleInstantiation instantiation(List<Problem> children,
        Recomposition recomposition, String label) {
      return new RuleInstantiation(FocusRule.this, children, recomposition,
          label);
    }

    RuleInstantiation focusConditional(GuideShape.Conditional conditional) {
      final Core.Exp condition = conditional.condition();
      final Core.Exp ifTrue = conditional.ifTrue();
      final Core.Exp ifFalse = conditional.ifFalse();

      if (Prop.CONDITION_PROBE.booleanValue(context.props)) {
        final RuleInstantiation instantiation = probeCondition(conditional);
        if (instantiation != null) {
          return instantiation;
        }
      }

      final Path path = problem.pathCondition;
      switch (classifier.classify(condition, evaluator)) {
      case ALWAYS_TRUE:
        final Problem thenProblem = problem.withWitnesses(witnesses(ifTrue))
            .withPathCondition(path.withCond(condition))
            .withExamples(filterIns(condition));
        return instantiation(ImmutableList.of(thenProblem),
            Recomposition.wrapConditionalBranch(Recomposition.Side.THEN,
                condition, ifFalse),
            "Focus on if-then");

      case ALWAYS_FALSE:
        final Core.Exp notCondition = core.not(condition);
        final Problem elseProblem = problem.withWitnesses(witnesses(ifFalse))
            .withPathCondition(path.withCond(notCondition))
            .withExamples(filterIns(notCondition));
        return instantiation(ImmutableList.of(elseProblem),
            Recomposition.wrapConditionalBranch(Recomposition.Side.ELSE,
                condition, ifTrue),
            "Focus on if-else");

      default:
        final Core.Exp notCondition2 = core.not(condition);
        final Problem problem1 = problem.withWitnesses(witnesses(ifTrue))
            .withPathCondition(path.withCond(condition))
            .withExamples(filterIns(condition));
        final Problem problem2 = problem.withWitnesses(witnesses(ifFalse))
            .withPathCondition(path.withCond(notCondition2))
            .withExamples(filterIns(notCondition2));
        return instantiation(ImmutableList.of(problem1, problem2),
            Recomposition.wrapConditionalBoth(condition),
            "Focus on both branches of '" + condition + "'");
      }
    }

    /** Tests whether negating the condition of a conditional would make the
     * function satisfy its postcondition on every failing example; if so,
     * creates a problem to find a new condition. */
    @Nullable RuleInstantiation probeCondition(
        GuideShape.Conditional conditional) {
      final Core.Exp condition = conditional.condition();
      final Core.Exp spec =
          functionSpec(context.functionContext, context.nameGenerator);
      final Core.Exp negatedSpec =
          Replacer.replace(spec, condition, core.not(condition));
      final Evaluator angelicEvaluator =
          new AngelicEvaluator(context.program, condition, context.props);
      if (classifier.classify(negatedSpec, angelicEvaluator)
          != Classification.ALWAYS_TRUE) {
        return null;
      }

      final Core.IdPat cond =
          context.nameGenerator.fresh(PrimitiveType.BOOL, "cond");
      final Problem condProblem =
          Problem.of(problem.inputs, problem.pathCondition,
              witnesses(condition),
              core.letTuple(problem.outputs,
                  conditional.withCondition(core.id(cond)), problem.spec),
              ImmutableList.of(cond), problem.examples.stripOuts());
      final Core.Hole hole = core.hole(PrimitiveType.BOOL, cond.toString());
      return instantiation(ImmutableList.of(condProblem),
          Recomposition.wrapTermHole(conditional.withCondition(hole), hole,
              core.boolLiteral(true)),
          "Focus on if-cond '" + condition + "'");
    }

    @Nullable RuleInstantiation focusMatch(GuideShape.PatternMatch match) {
      final Core.Case caseExp = match.exp;
      final Core.Exp scrut = match.scrut();
      final Path parentPath = problem.pathCondition;

      // Fold over the cases, left to right. "elsePath" holds when no case
      // so far has matched.
      final List<Core.Match> matchList = new ArrayList<>();
      final List<Integer> ordinals = new ArrayList<>();
      final List<Problem> children = new ArrayList<>();
      Path elsePath = Path.EMPTY;
      for (Core.Match m : caseExp.matchList) {
        final Path thisCond = Patterns.conditionForPattern(scrut, m.pat);
        final Path cond = elsePath.merge(thisCond);
        elsePath = elsePath.merge(thisCond.negate());
        if (classifier.existsFailing(cond.toClause(), evaluator)) {
          ordinals.add(matchList.size());
          children.add(caseProblem(scrut, m, cond));
        }
        matchList.add(m);
      }

      if (Prop.MISSING_CASE.booleanValue(context.props)
          && classifier.existsFailing(elsePath.toClause(), evaluator)) {
        final Core.Hole hole =
            context.nameGenerator.hole(caseExp.type, "case");
        final Core.Match wildcard =
            core.match(core.wildcardPat(scrut.type), hole);
        ordinals.add(matchList.size());
        children.add(
            problem.withWitnesses(others)
                .withPathCondition(parentPath.merge(elsePath))
                .withExamples(filterIns(elsePath.toClause())));
        matchList.add(wildcard);
      }

      if (children.isEmpty()) {
        return null;
      }

      final StringBuilder label = new StringBuilder("Focus on match-cases ");
      for (int i = 0; i < ordinals.size(); i++) {
        if (i > 0) {
          label.append(", ");
        }
        label.append('\'').append(matchList.get(ordinals.get(i)).pat)
            .append('\'');
      }
      return instantiation(children,
          Recomposition.wrapMatch(caseExp.type, scrut, matchList, ordinals,
              parentPath),
          label.toString());
    }

    /** Creates the problem for one case of a match. The variables bound by
     * the pattern become extra inputs. */
    Problem caseProblem(Core.Exp scrut, Core.Match m, Path cond) {
      final Map<Core.IdPat, Core.Exp> map =
          Patterns.mapForPattern(scrut, m.pat);
      final List<Core.IdPat> vars = ImmutableList.copyOf(map.keySet());
      final List<Core.Exp> extractors = ImmutableList.copyOf(map.values());

      ExampleBank examples = filterIns(cond.toClause());
      if (!vars.isEmpty()) {
        examples = examples.mapIns(ins -> extend(ins, extractors));
      }
      final Path path = Path.EMPTY.withBindings(map).merge(cond);
      return Problem.of(
          ImmutableList.<Core.IdPat>builder().addAll(problem.inputs)
              .addAll(vars).build(),
          problem.pathCondition.merge(path), witnesses(m.exp), problem.spec,
          problem.outputs, examples);
    }

    RuleInstantiation focusLet(GuideShape.Binding binding) {
      final Core.Let let = binding.exp;
      final Problem bodyProblem =
          Problem.of(
              ImmutableList.<Core.IdPat>builder().addAll(problem.inputs)
                  .add(let.idPat).build(),
              problem.pathCondition.withBinding(let.idPat, let.value),
              witnesses(let.exp), problem.spec, problem.outputs,
              problem.examples.mapIns(ins ->
                  extend(ins, ImmutableList.of(let.value))));
      return instantiation(ImmutableList.of(bodyProblem),
          Recomposition.wrapLet(let.idPat, let.value), "Focus on let-body");
    }
  }
}

// End FocusRule.java
