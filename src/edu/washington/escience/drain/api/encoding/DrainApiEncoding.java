package edu.washington.escience.drain.api.encoding;

import java.lang.annotation.Annotation;
import java.lang.reflect.Field;
import java.util.LinkedList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.google.common.base.Joiner;
import com.google.common.collect.Lists;

import edu.washington.escience.drain.ConfigurationException;

/**
 * The base of all encodings. In particular, the validate function must throw an exception explaining why the
 * deserialized object is incorrect.
 */
public abstract class DrainApiEncoding {
  /**
   * @return a list of required fields.
   */
  @JsonIgnore
  private List<Field> getRequiredFields() {
    Field[] fs = this.getClass().getFields();
    List<Field> requiredFields = new LinkedList<>();
    for (Field f : fs) {
      Annotation a = f.getAnnotation(Required.class);
      if (a != null) {
        requiredFields.add(f);
      }
    }
    return requiredFields;
  }

  /**
   * Checks that this deserialized instance passes input validation. First, it enforces that all required fields are
   * present. Second, it calls the child's method validateExtra().
   *
   * @throws ConfigurationException if the validation checks fail.
   */
  public final void validate() throws ConfigurationException {
    final List<String> missing = Lists.newLinkedList();
    try {
      for (final Field f : getRequiredFields()) {
        if (null == f.get(this)) {
          missing.add(f.getName());
        }
      }
    } catch (IllegalAccessException e) {
      throw new ConfigurationException("cannot read the fields of " + getClass().getName(), e);
    }
    if (!missing.isEmpty()) {
      final StringBuilder sb =
          new StringBuilder(getClass().getName()).append(" is missing required fields: ");
      sb.append(Joiner.on(", ").join(missing)).append('.');
      throw new ConfigurationException(sb.toString());
    }
    validateExtra();
  }

  /**
   * Adaptor function for extending encodings to use if they wish to add extra validation beyond the list of required
   * fields.
   *
   * @throws ConfigurationException if the validation checks fail.
   */
  protected void validateExtra() throws ConfigurationException {}
}
