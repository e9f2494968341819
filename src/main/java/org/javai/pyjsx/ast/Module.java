package org.javai.pyjsx.ast;

import java.util.List;

/**
 * A parsed source unit: its statements in order.
 */
public record Module(List<Stmt> body) {

	public Module {
		body = List.copyOf(body);
	}
}
