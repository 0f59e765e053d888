package com.acme.gateway.capability;

import com.acme.gateway.error.GatewayException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Declared argument shape of a capability. Validation is side-effect free: it either returns the
 * declared arguments (unknown keys dropped) or throws a {@code VALIDATION_ERROR}.
 */
public final class ParamSchema {

  public static final int MAX_SESSION_ID_LENGTH = 100;
  public static final int MAX_TEXT_LENGTH = 65536;
  public static final int MAX_ID_LENGTH = 128;
  public static final List<String> JID_SUFFIXES = List.of("@s.whatsapp.net", "@g.us", "@broadcast");

  private static final Pattern SESSION_ID = Pattern.compile("^[a-zA-Z0-9_-]+$");
  private static final int MAX_JID_LENGTH = 128;

  public enum Kind {
    STRING,
    SESSION_ID,
    JID,
    ENUM,
    INTEGER,
    BOOLEAN,
    OBJECT,
    LIST
  }

  /** One declared argument. */
  public record Field(
      String name,
      Kind kind,
      boolean required,
      int maxLength,
      long min,
      long max,
      Set<String> allowedValues,
      String description) {}

  private final List<Field> fields;

  private ParamSchema(List<Field> fields) {
    this.fields = Collections.unmodifiableList(fields);
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<Field> fields() {
    return fields;
  }

  public Map<String, Object> validate(Map<String, Object> args) {
    Map<String, Object> input = args == null ? Map.of() : args;
    Map<String, Object> valid = new LinkedHashMap<>();
    for (Field field : fields) {
      Object value = input.get(field.name());
      if (isMissing(value)) {
        if (field.required()) {
          throw GatewayException.validation(field.name() + " required");
        }
        continue;
      }
      valid.put(field.name(), check(field, value));
    }
    return valid;
  }

  private static boolean isMissing(Object value) {
    return value == null || (value instanceof String s && s.isEmpty());
  }

  private static Object check(Field field, Object value) {
    return switch (field.kind()) {
      case STRING -> checkLength(field, asString(field, value));
      case SESSION_ID -> checkSessionId(field, asString(field, value));
      case JID -> checkJid(field, asString(field, value));
      case ENUM -> checkEnum(field, asString(field, value));
      case INTEGER -> checkInteger(field, value);
      case BOOLEAN -> checkBoolean(field, value);
      case OBJECT -> checkObject(field, value);
      case LIST -> checkList(field, value);
    };
  }

  private static String asString(Field field, Object value) {
    if (!(value instanceof String s)) {
      throw GatewayException.validation(field.name() + " must be string");
    }
    return s;
  }

  private static String checkLength(Field field, String value) {
    if (value.length() > field.maxLength()) {
      throw GatewayException.validation(field.name() + " exceeds max length");
    }
    return value;
  }

  private static String checkSessionId(Field field, String value) {
    checkLength(field, value);
    if (!SESSION_ID.matcher(value).matches()) {
      throw GatewayException.validation(field.name() + " has invalid format");
    }
    return value;
  }

  private static String checkJid(Field field, String value) {
    checkLength(field, value);
    if (!value.contains("@")) {
      throw GatewayException.validation("invalid JID format");
    }
    if (JID_SUFFIXES.stream().noneMatch(value::endsWith) || value.indexOf('@') == 0) {
      throw GatewayException.validation("invalid JID suffix");
    }
    return value;
  }

  private static String checkEnum(Field field, String value) {
    if (!field.allowedValues().contains(value)) {
      throw GatewayException.validation(
          field.name() + " must be one of " + String.join(", ", field.allowedValues()));
    }
    return value;
  }

  private static Long checkInteger(Field field, Object value) {
    if (!(value instanceof Number n) || n.doubleValue() != Math.rint(n.doubleValue())) {
      throw GatewayException.validation(field.name() + " must be an integer");
    }
    long v = n.longValue();
    if (v < field.min() || v > field.max()) {
      throw GatewayException.validation(
          field.name() + " must be between " + field.min() + " and " + field.max());
    }
    return v;
  }

  private static Boolean checkBoolean(Field field, Object value) {
    if (!(value instanceof Boolean b)) {
      throw GatewayException.validation(field.name() + " must be boolean");
    }
    return b;
  }

  private static List<String> checkList(Field field, Object value) {
    if (!(value instanceof List<?> list)) {
      throw GatewayException.validation(field.name() + " must be a list");
    }
    if (list.size() > field.max()) {
      throw GatewayException.validation(field.name() + " has too many entries");
    }
    List<String> items = new ArrayList<>(list.size());
    for (Object item : list) {
      if (!(item instanceof String s) || s.isEmpty() || s.length() > field.maxLength()) {
        throw GatewayException.validation(field.name() + " contains an invalid entry");
      }
      items.add(s);
    }
    return items;
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> checkObject(Field field, Object value) {
    if (!(value instanceof Map<?, ?> map)) {
      throw GatewayException.validation(field.name() + " must be an object");
    }
    if (map.size() > field.maxLength()) {
      throw GatewayException.validation(field.name() + " has too many entries");
    }
    return (Map<String, Object>) map;
  }

  public static final class Builder {
    private final List<Field> fields = new ArrayList<>();

    public Builder sessionId() {
      return add(new Field("sessionId", Kind.SESSION_ID, true, MAX_SESSION_ID_LENGTH, 0, 0, Set.of(),
          "The session ID to use"));
    }

    public Builder jid(String name, String description) {
      return add(new Field(name, Kind.JID, true, MAX_JID_LENGTH, 0, 0, Set.of(), description));
    }

    public Builder text(String name, boolean required, String description) {
      return add(new Field(name, Kind.STRING, required, MAX_TEXT_LENGTH, 0, 0, Set.of(), description));
    }

    public Builder identifier(String name, boolean required, String description) {
      return add(new Field(name, Kind.STRING, required, MAX_ID_LENGTH, 0, 0, Set.of(), description));
    }

    public Builder oneOf(String name, Set<String> values, boolean required, String description) {
      return add(new Field(name, Kind.ENUM, required, 0, 0, 0, Set.copyOf(values), description));
    }

    public Builder integer(String name, long min, long max, String description) {
      return add(new Field(name, Kind.INTEGER, false, 0, min, max, Set.of(), description));
    }

    public Builder flag(String name, String description) {
      return add(new Field(name, Kind.BOOLEAN, false, 0, 0, 0, Set.of(), description));
    }

    public Builder stringList(String name, int maxEntries, String description) {
      return add(new Field(name, Kind.LIST, false, MAX_ID_LENGTH, 0, maxEntries, Set.of(), description));
    }

    public Builder object(String name, int maxEntries, String description) {
      return add(new Field(name, Kind.OBJECT, false, maxEntries, 0, 0, Set.of(), description));
    }

    private Builder add(Field field) {
      fields.add(field);
      return this;
    }

    public ParamSchema build() {
      return new ParamSchema(List.copyOf(fields));
    }
  }
}
