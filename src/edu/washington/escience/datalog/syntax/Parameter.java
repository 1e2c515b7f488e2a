package edu.washington.escience.datalog.syntax;

import java.util.Objects;

import org.apache.commons.lang3.builder.HashCodeBuilder;

/**
 * A parameter of a predicate: an {@link ParameterType#ID} naming a column or variable, or a
 * {@link ParameterType#STRING} literal. Immutable; equality is on both type and text.
 *
 */
public final class Parameter {
  /** Class-specific magic number used to generate the hash code. */
  private static final int MAGIC_HASHCODE1 = 255;
  /** Class-specific magic number used to generate the hash code. */
  private static final int MAGIC_HASHCODE2 = 69;

  /** The text of the parameter, without quotes for literals. */
  private final String value;
  /** The kind of parameter. */
  private final ParameterType type;

  /**
   * @param value the text of the parameter.
   * @param type the kind of parameter.
   */
  public Parameter(final String value, final ParameterType type) {
    this.value = Objects.requireNonNull(value, "value");
    this.type = Objects.requireNonNull(type, "type");
  }

  /**
   * @param name the identifier.
   * @return an ID parameter.
   */
  public static Parameter id(final String name) {
    return new Parameter(name, ParameterType.ID);
  }

  /**
   * @param literal the literal text, without quotes.
   * @return a STRING parameter.
   */
  public static Parameter string(final String literal) {
    return new Parameter(literal, ParameterType.STRING);
  }

  /** @return the text of this parameter. */
  public String getValue() {
    return value;
  }

  /** @return the kind of this parameter. */
  public ParameterType getType() {
    return type;
  }

  /** @return true iff this is an ID parameter. */
  public boolean isId() {
    return type == ParameterType.ID;
  }

  /** @return true iff this is a STRING parameter. */
  public boolean isString() {
    return type == ParameterType.STRING;
  }

  @Override
  public boolean equals(final Object obj) {
    if (!(obj instanceof Parameter)) {
      return false;
    }
    final Parameter other = (Parameter) obj;
    return type == other.type && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    final HashCodeBuilder hb = new HashCodeBuilder(MAGIC_HASHCODE1, MAGIC_HASHCODE2);
    hb.append(type);
    hb.append(value);
    return hb.toHashCode();
  }

  /**
   * @return the raw text, which is how a parameter appears in a rendered program.
   */
  @Override
  public String toString() {
    return value;
  }
}
