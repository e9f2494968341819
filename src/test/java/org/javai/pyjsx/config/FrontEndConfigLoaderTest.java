package org.javai.pyjsx.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.StringReader;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.logging.log4j.Level;
import org.javai.pyjsx.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FrontEndConfigLoaderTest {

	private FrontEndConfigLoader loader;

	@BeforeEach
	void setUp() {
		loader = new FrontEndConfigLoader();
	}

	@Nested
	@DisplayName("Classpath resources")
	class Resources {

		@Test
		void bundledResourceMatchesDefaults() {
			assertThat(loader.load()).isEqualTo(FrontEndConfig.defaults());
		}

		@Test
		void customResource() {
			FrontEndConfig config = loader.loadResource("META-INF/pyjsx/custom-frontend.yml",
					getClass().getClassLoader());

			assertThat(config.elementConstructor()).isEqualTo("jsx.runtime.create_element");
			assertThat(config.fragmentTag()).isEqualTo("jsx.Fragment");
		}

		@Test
		void unknownKeysAreLoggedAndIgnored() {
			try (LogCaptorAppender logs = LogCaptorAppender.create(FrontEndConfigLoader.class, Level.WARN)) {
				FrontEndConfig config = loader.loadResource("META-INF/pyjsx/unknown-key-frontend.yml",
						getClass().getClassLoader());

				assertThat(config).isEqualTo(new FrontEndConfig("h", null));
				assertThat(logs.messagesAt(Level.WARN))
						.containsExactly("Ignoring unknown front-end configuration key 'pragma'");
			}
		}

		@Test
		void missingResource() {
			assertThatThrownBy(() -> loader.loadResource("META-INF/pyjsx/absent.yml", getClass().getClassLoader()))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessage("Resource not found: META-INF/pyjsx/absent.yml");
		}

		@Test
		void fallsBackToDefaultsWithoutAResource() throws Exception {
			try (URLClassLoader empty = new URLClassLoader(new URL[0], null);
					LogCaptorAppender logs = LogCaptorAppender.create(FrontEndConfigLoader.class, Level.DEBUG)) {
				assertThat(loader.load(empty)).isEqualTo(FrontEndConfig.defaults());
				assertThat(logs.messagesAt(Level.DEBUG)).singleElement()
						.asString().contains("using default front-end configuration");
			}
		}
	}

	@Nested
	@DisplayName("YAML documents")
	class Documents {

		@Test
		void missingKeysKeepDefaults() {
			assertThat(loader.parseString("fragment_tag: Fragment")).isEqualTo(new FrontEndConfig("jsx", "Fragment"));
			assertThat(loader.parseString("element_constructor: h")).isEqualTo(new FrontEndConfig("h", null));
		}

		@Test
		void noneFragmentTag() {
			assertThat(loader.parseString("fragment_tag: None").fragmentTag()).isNull();
			assertThat(loader.parseString("fragment_tag: ~").fragmentTag()).isNull();
		}

		@Test
		void emptyDocumentIsDefaults() {
			assertThat(loader.parseString("")).isEqualTo(FrontEndConfig.defaults());
		}

		@Test
		void readerAndPathSources(@TempDir Path dir) throws Exception {
			Path file = dir.resolve("frontend.yml");
			Files.writeString(file, "element_constructor: ui.h\n");

			assertThat(loader.parse(file).elementConstructor()).isEqualTo("ui.h");
			assertThat(loader.parse(new StringReader("element_constructor: ui.h")).elementConstructor())
					.isEqualTo("ui.h");
		}

		@Test
		void nonStringValue() {
			assertThatThrownBy(() -> loader.parseString("element_constructor: 42"))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessage("'element_constructor' must be a string, found Integer");
		}

		@Test
		void invalidIdentifier() {
			assertThatThrownBy(() -> loader.parseString("element_constructor: my-jsx"))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessage("Invalid element constructor 'my-jsx': each segment must be an identifier");
		}

		@Test
		void keywordSegment() {
			assertThatThrownBy(() -> loader.parseString("fragment_tag: jsx.class"))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessageContaining("Invalid fragment tag 'jsx.class'");
		}

		@Test
		void documentMustBeAMapping() {
			assertThatThrownBy(() -> loader.parseString("- jsx"))
					.isInstanceOf(IllegalStateException.class)
					.hasRootCauseMessage("Front-end configuration must be a mapping, found ArrayList");
		}

		@Test
		void malformedYaml() {
			assertThatThrownBy(() -> loader.parseString("element_constructor: [unclosed"))
					.isInstanceOf(IllegalStateException.class)
					.hasMessage("Failed to load front-end configuration from string");
		}

		@Test
		void missingFile(@TempDir Path dir) {
			assertThatThrownBy(() -> loader.parse(dir.resolve("absent.yml")))
					.isInstanceOf(IllegalStateException.class)
					.hasMessageStartingWith("Failed to load front-end configuration from path: ");
		}
	}

	@Nested
	@DisplayName("Config values")
	class ConfigValues {

		@Test
		void blankConstructorIsRejected() {
			assertThatThrownBy(() -> new FrontEndConfig(" ", null))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessage("The element constructor must not be blank");
		}

		@Test
		void withersKeepTheOtherField() {
			FrontEndConfig config = FrontEndConfig.defaults().withFragmentTag("F").withElementConstructor("h");

			assertThat(config).isEqualTo(new FrontEndConfig("h", "F"));
		}
	}
}
