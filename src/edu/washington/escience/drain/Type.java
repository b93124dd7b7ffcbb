package edu.washington.escience.drain;

import java.io.Serializable;

import org.joda.time.DateTime;

/**
 * Class representing the type of a table column in drain. Types are static objects defined by this class; hence, the
 * Type constructor is private. Every type admits <code>null</code> as a missing value.
 */
public enum Type implements Serializable {
  /**
   * boolean type.
   * */
  BOOLEAN_TYPE() {
    @Override
    public Class<?> toJavaObjectType() {
      return Boolean.class;
    }

    @Override
    public String getName() {
      return "Boolean";
    }
  },

  /**
   * int type.
   * */
  INT_TYPE() {
    @Override
    public Class<?> toJavaObjectType() {
      return Integer.class;
    }

    @Override
    public String getName() {
      return "Int";
    }
  },

  /**
   * long type.
   * */
  LONG_TYPE() {
    @Override
    public Class<?> toJavaObjectType() {
      return Long.class;
    }

    @Override
    public String getName() {
      return "Long";
    }
  },

  /**
   * Double type.
   * */
  DOUBLE_TYPE() {
    @Override
    public Class<?> toJavaObjectType() {
      return Double.class;
    }

    @Override
    public String getName() {
      return "Double";
    }
  },

  /**
   * String type.
   * */
  STRING_TYPE() {
    @Override
    public Class<?> toJavaObjectType() {
      return String.class;
    }

    @Override
    public String getName() {
      return "String";
    }
  },

  /**
   * date type.
   * */
  DATETIME_TYPE() {
    @Override
    public Class<?> toJavaObjectType() {
      return DateTime.class;
    }

    @Override
    public String getName() {
      return "DateTime";
    }
  };

  /**
   * @return the non primitive java type
   */
  public abstract Class<?> toJavaObjectType();

  /**
   * @return The name of the type usually used in the code.
   */
  public abstract String getName();

  /**
   * @return true if values of this type can be summed and averaged.
   */
  public boolean isNumeric() {
    return this == INT_TYPE || this == LONG_TYPE || this == DOUBLE_TYPE;
  }

  /**
   * @param value a value, possibly null.
   * @return true if the value may be stored in a column of this type.
   */
  public boolean isValid(final Object value) {
    return value == null || toJavaObjectType().isInstance(value);
  }

  /**
   * @param c the Java class to be converted to a drain Type
   * @return the associated drain Type for a Java class, or null if there is none.
   */
  public static Type fromJavaType(final Class<?> c) {
    if (c == null) {
      return null;
    } else if (c.equals(Integer.class) || c.equals(int.class)) {
      return INT_TYPE;
    } else if (c.equals(Double.class) || c.equals(double.class)) {
      return DOUBLE_TYPE;
    } else if (c.equals(Boolean.class) || c.equals(boolean.class)) {
      return BOOLEAN_TYPE;
    } else if (c.equals(String.class)) {
      return STRING_TYPE;
    } else if (c.equals(Long.class) || c.equals(long.class)) {
      return LONG_TYPE;
    } else if (DateTime.class.isAssignableFrom(c)) {
      return DATETIME_TYPE;
    } else {
      return null;
    }
  }

  /**
   * Infer the type of a value.
   *
   * @param value a non-null value.
   * @return the type of the value.
   * @throws IllegalArgumentException if the value has no drain type.
   */
  public static Type of(final Object value) {
    if (value == null) {
      throw new IllegalArgumentException("cannot infer the type of a null value");
    }
    Type t = fromJavaType(value.getClass());
    if (t == null) {
      throw new IllegalArgumentException(
          "Object of type " + value.getClass() + " is not a valid drain type");
    }
    return t;
  }
}
