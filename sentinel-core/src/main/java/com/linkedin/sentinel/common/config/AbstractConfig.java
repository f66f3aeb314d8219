/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.sentinel.common.config;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Base class of the typed config objects. Parses the supplied properties against a {@link ConfigDef} once, at
 * construction, and exposes the parsed values through typed getters. Subclasses hook
 * {@link #postProcessParsedConfig(Map)} for derived values and cross-key checks.
 */
public class AbstractConfig {
  private static final Logger LOG = LoggerFactory.getLogger(AbstractConfig.class);

  private final ConfigDef _definition;
  private final Set<String> _suppliedKeys;
  private final Map<String, Object> _values;
  private final Set<String> _requestedKeys = ConcurrentHashMap.newKeySet();

  public AbstractConfig(ConfigDef definition, Map<?, ?> originals, boolean doLog) {
    _definition = definition;
    _suppliedKeys = new HashSet<>();
    for (Object key : originals.keySet()) {
      if (!(key instanceof String)) {
        throw new ConfigException(String.valueOf(key), originals.get(key), "Key must be a string.");
      }
      _suppliedKeys.add((String) key);
    }
    _values = definition.parse(originals);
    _values.putAll(postProcessParsedConfig(Collections.unmodifiableMap(_values)));
    if (doLog) {
      LOG.info("{} values: {}", getClass().getSimpleName(), new TreeMap<>(_values));
    }
  }

  public AbstractConfig(ConfigDef definition, Map<?, ?> originals) {
    this(definition, originals, true);
  }

  /**
   * Invoked once the supplied values are parsed and defaults are filled in.
   *
   * @param parsedValues Read-only view of the parsed values.
   * @return Values to add or override; empty by default.
   * @throws ConfigException to reject a combination of individually valid values.
   */
  protected Map<String, Object> postProcessParsedConfig(Map<String, Object> parsedValues) {
    return Collections.emptyMap();
  }

  protected Object get(String key) {
    Object value = _values.get(key);
    if (value == null && !_values.containsKey(key)) {
      throw new ConfigException(String.format("Unknown configuration '%s'", key));
    }
    _requestedKeys.add(key);
    return value;
  }

  public Integer getInt(String key) {
    return (Integer) get(key);
  }

  public Long getLong(String key) {
    return (Long) get(key);
  }

  public Double getDouble(String key) {
    return (Double) get(key);
  }

  public Boolean getBoolean(String key) {
    return (Boolean) get(key);
  }

  public String getString(String key) {
    return (String) get(key);
  }

  @SuppressWarnings("unchecked")
  public List<String> getList(String key) {
    return (List<String>) get(key);
  }

  /**
   * @param key Config key.
   * @return The declared type of the key, or {@code null} if it is not defined.
   */
  public ConfigDef.Type typeOf(String key) {
    ConfigDef.ConfigKey configKey = _definition.configKeys().get(key);
    return configKey == null ? null : configKey.type();
  }

  /**
   * @return Supplied keys that no getter has asked for, typically typos or keys of another component.
   */
  public Set<String> unused() {
    Set<String> unused = new HashSet<>(_suppliedKeys);
    unused.removeAll(_requestedKeys);
    return unused;
  }
}
