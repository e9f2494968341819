package org.javai.pyjsx;

import java.util.Objects;
import org.javai.pyjsx.ast.Module;

/**
 * Result of compiling one source unit.
 *
 * @param name the module name
 * @param body the parsed statements, markup already lowered
 * @param markupLiterals number of markup literals reached from code, including
 *        those nested inside expression holes and f-string fields
 */
public record CompiledModule(String name, Module body, int markupLiterals) {

	public CompiledModule {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(body, "body must not be null");
	}

	/**
	 * Whether the module calls the element constructor, and so needs it bound
	 * at runtime.
	 */
	public boolean usesMarkup() {
		return markupLiterals > 0;
	}
}
