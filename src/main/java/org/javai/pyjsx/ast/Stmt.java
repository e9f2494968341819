package org.javai.pyjsx.ast;

import java.util.List;
import java.util.Objects;

/**
 * Statement node of a parsed module.
 */
public sealed interface Stmt {

	/**
	 * {@code t1 = t2 = value}: targets in source order.
	 */
	record Assign(List<Expr> targets, Expr value) implements Stmt {
		public Assign {
			targets = List.copyOf(targets);
			Objects.requireNonNull(value, "value must not be null");
			if (targets.isEmpty()) {
				throw new IllegalArgumentException("Assign needs at least one target");
			}
		}
	}

	record ExprStmt(Expr value) implements Stmt {
		public ExprStmt {
			Objects.requireNonNull(value, "value must not be null");
		}
	}

	/**
	 * {@code import a.b as c, d}.
	 */
	record Import(List<Alias> names) implements Stmt {
		public Import {
			names = List.copyOf(names);
		}
	}

	/**
	 * {@code from module import a as b, c}.
	 */
	record ImportFrom(String module, List<Alias> names) implements Stmt {
		public ImportFrom {
			Objects.requireNonNull(module, "module must not be null");
			names = List.copyOf(names);
		}
	}

	/**
	 * An imported name and its optional local alias (null when absent).
	 */
	record Alias(String name, String asName) {
		public Alias {
			Objects.requireNonNull(name, "name must not be null");
		}
	}
}
