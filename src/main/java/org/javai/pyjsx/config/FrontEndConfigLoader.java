package org.javai.pyjsx.config;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads {@link FrontEndConfig} from YAML.
 * <p>
 * Recognised keys are {@code element_constructor} and {@code fragment_tag};
 * a missing key keeps its default. {@code fragment_tag: None} (or null) means
 * fragments are tagged with {@code None}.
 * <pre>
 * element_constructor: jsx
 * fragment_tag: None
 * </pre>
 */
public final class FrontEndConfigLoader {

	private static final Logger logger = LoggerFactory.getLogger(FrontEndConfigLoader.class);

	public static final String DEFAULT_RESOURCE = "META-INF/pyjsx/frontend.yml";

	private static final String ELEMENT_CONSTRUCTOR = "element_constructor";
	private static final String FRAGMENT_TAG = "fragment_tag";
	private static final Set<String> KNOWN_KEYS = Set.of(ELEMENT_CONSTRUCTOR, FRAGMENT_TAG);

	private final Yaml yaml = new Yaml();

	/**
	 * Loads the default resource with this class' loader, falling back to
	 * {@link FrontEndConfig#defaults()} when it is absent.
	 */
	public FrontEndConfig load() {
		return load(FrontEndConfigLoader.class.getClassLoader());
	}

	public FrontEndConfig load(ClassLoader loader) {
		Objects.requireNonNull(loader, "loader must not be null");
		if (loader.getResource(DEFAULT_RESOURCE) == null) {
			logger.debug("No {} on the classpath; using default front-end configuration", DEFAULT_RESOURCE);
			return FrontEndConfig.defaults();
		}
		return loadResource(DEFAULT_RESOURCE, loader);
	}

	/**
	 * Loads configuration from a classpath resource.
	 *
	 * @throws IllegalArgumentException if the resource cannot be found or holds
	 *         an invalid value
	 * @throws IllegalStateException if the document cannot be read
	 */
	public FrontEndConfig loadResource(String resourcePath, ClassLoader loader) {
		Objects.requireNonNull(resourcePath, "resourcePath must not be null");
		Objects.requireNonNull(loader, "loader must not be null");
		try (InputStream is = loader.getResourceAsStream(resourcePath)) {
			if (is == null) {
				throw new IllegalArgumentException("Resource not found: " + resourcePath);
			}
			FrontEndConfig config = build(yaml.load(is));
			logger.debug("Loaded front-end configuration from {}: {}", resourcePath, config);
			return config;
		} catch (IllegalArgumentException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to load front-end configuration from resource: " + resourcePath, e);
		}
	}

	public FrontEndConfig parse(Path path) {
		Objects.requireNonNull(path, "path must not be null");
		try (var reader = Files.newBufferedReader(path)) {
			return build(yaml.load(reader));
		} catch (IllegalArgumentException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to load front-end configuration from path: " + path, e);
		}
	}

	public FrontEndConfig parse(Reader reader) {
		try {
			return build(yaml.load(reader));
		} catch (IllegalArgumentException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to load front-end configuration from reader", e);
		}
	}

	public FrontEndConfig parseString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent));
		} catch (IllegalArgumentException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to load front-end configuration from string", e);
		}
	}

	private FrontEndConfig build(Object document) {
		if (document == null) {
			return FrontEndConfig.defaults();
		}
		if (!(document instanceof Map<?, ?> data)) {
			throw new IllegalStateException("Front-end configuration must be a mapping, found "
					+ document.getClass().getSimpleName());
		}
		for (Object key : data.keySet()) {
			if (!KNOWN_KEYS.contains(String.valueOf(key))) {
				logger.warn("Ignoring unknown front-end configuration key '{}'", key);
			}
		}

		FrontEndConfig config = FrontEndConfig.defaults();
		if (data.containsKey(ELEMENT_CONSTRUCTOR)) {
			config = config.withElementConstructor(stringValue(ELEMENT_CONSTRUCTOR, data.get(ELEMENT_CONSTRUCTOR)));
		}
		Object fragmentTag = data.get(FRAGMENT_TAG);
		if (fragmentTag != null && !"None".equals(fragmentTag)) {
			config = config.withFragmentTag(stringValue(FRAGMENT_TAG, fragmentTag));
		}
		return config;
	}

	private static String stringValue(String key, Object value) {
		if (!(value instanceof String text)) {
			throw new IllegalArgumentException("'" + key + "' must be a string, found "
					+ (value == null ? "null" : value.getClass().getSimpleName()));
		}
		return text;
	}
}
