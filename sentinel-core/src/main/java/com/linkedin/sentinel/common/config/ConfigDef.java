/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.common.config;

import com.linkedin.sentinel.common.utils.Utils;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;


/**
 * The set of keys a component accepts, each with a type, an optional default, an optional {@link Validator} and a
 * documentation string. Detector and engine configs declare one static instance each and hand it to
 * {@link AbstractConfig}:
 * <pre>
 * ConfigDef def = new ConfigDef()
 *     .define("zscore.detector.threshold", Type.DOUBLE, 3.0, Range.greaterThan(0.0), Importance.HIGH, "...");
 * Map&lt;String, Object&gt; parsed = def.parse(props);
 * </pre>
 * Values may be supplied as strings (e.g. from a properties file) or already typed. Keys that are not defined are
 * ignored by {@link #parse(Map)}.
 */
public class ConfigDef {
  /**
   * Marker default for keys the caller must always supply.
   */
  public static final Object NO_DEFAULT_VALUE = new Object();

  private final Map<String, ConfigKey> _configKeys = new LinkedHashMap<>();

  public ConfigDef define(ConfigKey key) {
    if (_configKeys.putIfAbsent(key.name(), key) != null) {
      throw new ConfigException("Configuration " + key.name() + " is defined twice.");
    }
    return this;
  }

  public ConfigDef define(String name, Type type, Object defaultValue, Validator validator, Importance importance,
                          String documentation) {
    return define(new ConfigKey(name, type, defaultValue, validator, importance, documentation));
  }

  public ConfigDef define(String name, Type type, Object defaultValue, Importance importance, String documentation) {
    return define(name, type, defaultValue, null, importance, documentation);
  }

  /**
   * Define a required key, i.e. one without a default value.
   */
  public ConfigDef define(String name, Type type, Importance importance, String documentation) {
    return define(name, type, NO_DEFAULT_VALUE, null, importance, documentation);
  }

  /**
   * @return Defined keys in definition order.
   */
  public Map<String, ConfigKey> configKeys() {
    return Collections.unmodifiableMap(_configKeys);
  }

  /**
   * Resolve every defined key against the given properties: supplied values are converted to the key's type,
   * missing ones fall back to the default, and the result is checked by the key's validator.
   *
   * @param props Raw properties, either strings or already typed values.
   * @return Parsed values by key name.
   * @throws ConfigException if a required key is missing or a value cannot be converted or fails validation.
   */
  public Map<String, Object> parse(Map<?, ?> props) {
    Map<String, Object> parsed = new HashMap<>();
    for (ConfigKey key : _configKeys.values()) {
      parsed.put(key.name(), key.resolve(props));
    }
    return parsed;
  }

  /**
   * Supported value types. Each knows how to convert a raw value, string or typed, into its Java representation.
   */
  public enum Type {
    BOOLEAN {
      @Override
      Object convert(String name, Object value, String trimmed) {
        if (value instanceof Boolean) {
          return value;
        }
        if (trimmed != null && (trimmed.equalsIgnoreCase("true") || trimmed.equalsIgnoreCase("false"))) {
          return Boolean.parseBoolean(trimmed);
        }
        throw new ConfigException(name, value, "Expected value to be either true or false");
      }
    },
    STRING {
      @Override
      Object convert(String name, Object value, String trimmed) {
        if (trimmed == null) {
          throw mismatch(name, value, "a string");
        }
        return trimmed;
      }
    },
    INT {
      @Override
      Object convert(String name, Object value, String trimmed) {
        if (value instanceof Integer) {
          return value;
        }
        if (trimmed == null) {
          throw mismatch(name, value, "a 32-bit integer");
        }
        return Integer.parseInt(trimmed);
      }
    },
    LONG {
      @Override
      Object convert(String name, Object value, String trimmed) {
        if (value instanceof Integer || value instanceof Long) {
          return ((Number) value).longValue();
        }
        if (trimmed == null) {
          throw mismatch(name, value, "a 64-bit integer");
        }
        return Long.parseLong(trimmed);
      }
    },
    DOUBLE {
      @Override
      Object convert(String name, Object value, String trimmed) {
        if (value instanceof Number) {
          return ((Number) value).doubleValue();
        }
        if (trimmed == null) {
          throw mismatch(name, value, "a double");
        }
        return Double.parseDouble(trimmed);
      }
    },
    LIST {
      @Override
      Object convert(String name, Object value, String trimmed) {
        if (value instanceof List) {
          return value;
        }
        if (trimmed == null) {
          throw new ConfigException(name, value, "Expected a comma separated list.");
        }
        return trimmed.isEmpty() ? Collections.emptyList() : Arrays.asList(trimmed.split("\\s*,\\s*", -1));
      }
    };

    abstract Object convert(String name, Object value, String trimmed);

    /**
     * Convert the given raw value to this type.
     *
     * @param name Config name, used in error messages.
     * @param value Raw value, may be {@code null}.
     * @return The converted value, or {@code null} for a {@code null} input.
     */
    public Object parse(String name, Object value) {
      if (value == null) {
        return null;
      }
      String trimmed = value instanceof String ? ((String) value).trim() : null;
      try {
        return convert(name, value, trimmed);
      } catch (NumberFormatException e) {
        throw new ConfigException(name, value, "Not a number of type " + this);
      }
    }

    private static ConfigException mismatch(String name, Object value, String expected) {
      return new ConfigException(name, value,
                                 String.format("Expected value to be %s, but it was a %s", expected, value.getClass().getName()));
    }
  }

  public enum Importance {
    HIGH, MEDIUM, LOW
  }

  /**
   * Checks a single parsed value.
   */
  public interface Validator {
    /**
     * @param name Config name.
     * @param value Parsed value.
     * @throws ConfigException if the value is not acceptable.
     */
    void ensureValid(String name, Object value);
  }

  /**
   * Numeric bounds. The lower bound is either inclusive ({@link #atLeast}, {@link #between}) or exclusive
   * ({@link #greaterThan}); the upper bound is always inclusive. NaN is never in range.
   */
  public static final class Range implements Validator {
    private final Number _min;
    private final Number _max;
    private final boolean _exclusiveMin;

    private Range(Number min, Number max, boolean exclusiveMin) {
      _min = min;
      _max = max;
      _exclusiveMin = exclusiveMin;
    }

    public static Range atLeast(Number min) {
      return new Range(min, null, false);
    }

    /**
     * Used for thresholds and multipliers, where zero is meaningless.
     */
    public static Range greaterThan(Number min) {
      return new Range(min, null, true);
    }

    public static Range between(Number min, Number max) {
      return new Range(min, max, false);
    }

    @Override
    public void ensureValid(String name, Object value) {
      if (!(value instanceof Number)) {
        throw new ConfigException(name, value, "Value must be a non-null number");
      }
      double v = ((Number) value).doubleValue();
      // NaN compares false against either bound.
      if (Double.isNaN(v)) {
        throw new ConfigException(name, value, "Value must be a number");
      }
      if (_min != null) {
        double min = _min.doubleValue();
        if (_exclusiveMin ? v <= min : v < min) {
          throw new ConfigException(name, value, (_exclusiveMin ? "Value must be greater than " : "Value must be at least ") + _min);
        }
      }
      if (_max != null && v > _max.doubleValue()) {
        throw new ConfigException(name, value, "Value must be no more than " + _max);
      }
    }

    @Override
    public String toString() {
      String lower = _min == null ? "(-inf" : (_exclusiveMin ? "(" : "[") + _min;
      String upper = _max == null ? "+inf)" : _max + "]";
      return lower + ", " + upper;
    }
  }

  /**
   * Lists whose entries each come from a fixed vocabulary, with no entry repeated. Used for ordered detector names.
   */
  public static final class ValidList implements Validator {
    private final ValidString _entry;

    private ValidList(ValidString entry) {
      _entry = entry;
    }

    public static ValidList in(String... validStrings) {
      return new ValidList(ValidString.in(validStrings));
    }

    @Override
    public void ensureValid(String name, Object value) {
      if (!(value instanceof List)) {
        throw new ConfigException(name, value, "Expected a list");
      }
      Set<Object> seen = new HashSet<>();
      for (Object entry : (List<?>) value) {
        _entry.ensureValid(name, entry);
        if (!seen.add(entry)) {
          throw new ConfigException(name, value, "Duplicate entry " + entry);
        }
      }
    }

    @Override
    public String toString() {
      return _entry.toString();
    }
  }

  /**
   * Strings restricted to a fixed vocabulary, e.g. policy names.
   */
  public static final class ValidString implements Validator {
    private final List<String> _allowed;

    private ValidString(List<String> allowed) {
      _allowed = allowed;
    }

    public static ValidString in(String... validStrings) {
      return new ValidString(Arrays.asList(validStrings));
    }

    @Override
    public void ensureValid(String name, Object value) {
      if (!_allowed.contains(value)) {
        throw new ConfigException(name, value, "String must be one of: " + Utils.join(_allowed, ", "));
      }
    }

    @Override
    public String toString() {
      return "[" + Utils.join(_allowed, ", ") + "]";
    }
  }

  /**
   * A single defined key. The default value, if any, is converted and validated when the key is created so that a
   * broken definition fails at class initialization rather than on first use.
   */
  public static final class ConfigKey {
    private final String _name;
    private final Type _type;
    private final Object _defaultValue;
    private final Validator _validator;
    private final Importance _importance;
    private final String _documentation;

    public ConfigKey(String name, Type type, Object defaultValue, Validator validator, Importance importance,
                     String documentation) {
      _name = name;
      _type = type;
      _validator = validator;
      _importance = importance;
      _documentation = documentation;
      if (defaultValue == NO_DEFAULT_VALUE) {
        _defaultValue = NO_DEFAULT_VALUE;
      } else {
        _defaultValue = type.parse(name, defaultValue);
        validate(_defaultValue);
      }
    }

    Object resolve(Map<?, ?> props) {
      Object value;
      if (props.containsKey(_name)) {
        value = _type.parse(_name, props.get(_name));
      } else if (hasDefault()) {
        value = _defaultValue;
      } else {
        throw new ConfigException("Missing required configuration \"" + _name + "\" which has no default value.");
      }
      validate(value);
      return value;
    }

    private void validate(Object value) {
      if (_validator != null) {
        _validator.ensureValid(_name, value);
      }
    }

    public boolean hasDefault() {
      return _defaultValue != NO_DEFAULT_VALUE;
    }

    public String name() {
      return _name;
    }

    public Type type() {
      return _type;
    }

    public Object defaultValue() {
      return _defaultValue;
    }

    public Validator validator() {
      return _validator;
    }

    public Importance importance() {
      return _importance;
    }

    public String documentation() {
      return _documentation;
    }
  }
}
