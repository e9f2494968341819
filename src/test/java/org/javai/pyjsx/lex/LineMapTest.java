package org.javai.pyjsx.lex;

import static org.assertj.core.api.Assertions.assertThat;

import org.javai.pyjsx.SourcePosition;
import org.junit.jupiter.api.Test;

class LineMapTest {

	@Test
	void mapsOffsetsToOneBasedLinesAndColumns() {
		LineMap map = new LineMap("ab\ncd\r\nef\rg");

		assertThat(map.lineCount()).isEqualTo(4);
		assertThat(map.positionOf(0)).isEqualTo(new SourcePosition(0, 1, 1));
		assertThat(map.positionOf(4)).isEqualTo(new SourcePosition(4, 2, 2));
		assertThat(map.positionOf(7)).isEqualTo(new SourcePosition(7, 3, 1));
		assertThat(map.positionOf(10)).isEqualTo(new SourcePosition(10, 4, 1));
	}

	@Test
	void endOfInputIsOnTheLastLine() {
		LineMap map = new LineMap("x\n");

		assertThat(map.positionOf(2).line()).isEqualTo(2);
		assertThat(map.positionOf(2).toString()).isEqualTo("2:1");
	}
}
