package io.surfworks.yovec.env;

import io.surfworks.yovec.symbolic.Shape;
import io.surfworks.yovec.symbolic.SimpleMatrix;
import io.surfworks.yovec.symbolic.SimpleNumber;
import io.surfworks.yovec.symbolic.SimpleVector;
import io.surfworks.yovec.symbolic.SymbolicValue;

/**
 * What an identifier is bound to in an {@link Environment}.
 */
public sealed interface Binding permits Binding.Imported, Binding.Exported, Binding.Register {

    /**
     * Short human-readable kind, used in error messages.
     */
    String describe();

    /**
     * A binding materialized in a register.
     */
    sealed interface Register extends Binding permits NumberBinding, VectorBinding, MatrixBinding {
        int index();

        SymbolicValue value();

        default Shape shape() {
            return value().shape();
        }
    }

    /**
     * Name supplied from outside the program.
     */
    record Imported() implements Binding {
        @Override
        public String describe() {
            return "import";
        }
    }

    /**
     * Marker recording that a variable has been exported.
     */
    record Exported() implements Binding {
        @Override
        public String describe() {
            return "export";
        }
    }

    record NumberBinding(int index, SimpleNumber value) implements Register {
        @Override
        public String describe() {
            return "number";
        }
    }

    record VectorBinding(int index, SimpleVector value) implements Register {
        @Override
        public String describe() {
            return "vector";
        }
    }

    record MatrixBinding(int index, SimpleMatrix value) implements Register {
        @Override
        public String describe() {
            return "matrix";
        }
    }
}
