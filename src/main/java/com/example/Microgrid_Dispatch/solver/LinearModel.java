package com.example.Microgrid_Dispatch.solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Solver-neutral mixed-integer linear program.
 *
 * Variables are addressed by the index returned from {@link #addVariable};
 * constraints are ranges {@code lower <= sum(coef * x) <= upper}, with
 * infinite bounds for one-sided rows. The objective is always minimised.
 * A model is built by one thread and handed to a solver; it holds no solver
 * state.
 */
public class LinearModel {

    public static final double INFINITY = Double.POSITIVE_INFINITY;

    private final String name;
    private final List<Variable> variables = new ArrayList<>();
    private final List<Constraint> constraints = new ArrayList<>();
    private final Map<Integer, Double> objective = new LinkedHashMap<>();
    private double objectiveOffset = 0.0;

    public LinearModel(String name) {
        this.name = name;
    }

    public int addVariable(String name, double lower, double upper, boolean integer) {
        variables.add(new Variable(variables.size(), name, lower, upper, integer));
        return variables.size() - 1;
    }

    public int addContinuous(String name, double lower, double upper) {
        return addVariable(name, lower, upper, false);
    }

    public int addBinary(String name) {
        return addVariable(name, 0.0, 1.0, true);
    }

    public Constraint addConstraint(String name, double lower, double upper) {
        Constraint constraint = new Constraint(name, lower, upper);
        constraints.add(constraint);
        return constraint;
    }

    public Constraint addEquality(String name, double rhs) {
        return addConstraint(name, rhs, rhs);
    }

    public Constraint addLessOrEqual(String name, double rhs) {
        return addConstraint(name, -INFINITY, rhs);
    }

    public Constraint addGreaterOrEqual(String name, double rhs) {
        return addConstraint(name, rhs, INFINITY);
    }

    /** Adds to the objective coefficient of a variable (accumulates). */
    public void addObjectiveTerm(int variable, double coefficient) {
        objective.merge(variable, coefficient, Double::sum);
    }

    public void addObjectiveConstant(double value) {
        objectiveOffset += value;
    }

    public String getName() { return name; }
    public List<Variable> getVariables() { return Collections.unmodifiableList(variables); }
    public List<Constraint> getConstraints() { return Collections.unmodifiableList(constraints); }
    public Map<Integer, Double> getObjective() { return Collections.unmodifiableMap(objective); }
    public double getObjectiveOffset() { return objectiveOffset; }

    public int getVariableCount() {
        return variables.size();
    }

    public int getConstraintCount() {
        return constraints.size();
    }

    public long getIntegerVariableCount() {
        return variables.stream().filter(Variable::isInteger).count();
    }

    public Variable getVariable(int index) {
        return variables.get(index);
    }

    public Constraint findConstraint(String constraintName) {
        return constraints.stream()
                .filter(constraint -> constraint.getName().equals(constraintName))
                .findFirst()
                .orElse(null);
    }

    /** Objective value of an assignment, offset included. */
    public double evaluateObjective(double[] values) {
        double total = objectiveOffset;
        for (Map.Entry<Integer, Double> term : objective.entrySet()) {
            total += term.getValue() * values[term.getKey()];
        }
        return total;
    }

    @Override
    public String toString() {
        return String.format("LinearModel{name='%s', variables=%d (integer=%d), constraints=%d}",
                name, getVariableCount(), getIntegerVariableCount(), getConstraintCount());
    }

    public static class Variable {
        private final int index;
        private final String name;
        private final double lower;
        private final double upper;
        private final boolean integer;

        Variable(int index, String name, double lower, double upper, boolean integer) {
            this.index = index;
            this.name = name;
            this.lower = lower;
            this.upper = upper;
            this.integer = integer;
        }

        public int getIndex() { return index; }
        public String getName() { return name; }
        public double getLower() { return lower; }
        public double getUpper() { return upper; }
        public boolean isInteger() { return integer; }

        @Override
        public String toString() {
            return String.format("%s[%s, %s]%s", name, lower, upper, integer ? " int" : "");
        }
    }

    public static class Constraint {
        private final String name;
        private final double lower;
        private final double upper;
        private final Map<Integer, Double> coefficients = new LinkedHashMap<>();

        Constraint(String name, double lower, double upper) {
            this.name = name;
            this.lower = lower;
            this.upper = upper;
        }

        /** Accumulates, so the same variable may appear twice while building. */
        public Constraint term(int variable, double coefficient) {
            coefficients.merge(variable, coefficient, Double::sum);
            return this;
        }

        public String getName() { return name; }
        public double getLower() { return lower; }
        public double getUpper() { return upper; }
        public Map<Integer, Double> getCoefficients() { return Collections.unmodifiableMap(coefficients); }

        public double getCoefficient(int variable) {
            return coefficients.getOrDefault(variable, 0.0);
        }

        @Override
        public String toString() {
            return String.format("%s: %s <= %s <= %s", name, lower, coefficients, upper);
        }
    }
}
