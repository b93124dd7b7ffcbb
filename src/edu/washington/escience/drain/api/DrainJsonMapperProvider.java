package edu.washington.escience.drain.api;

import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.datatype.joda.JodaModule;

/**
 * Holds the {@link ObjectMapper} used to read and write drain's JSON encodings.
 */
public final class DrainJsonMapperProvider {
  /** Only create this object once, and share it. */
  private static final ObjectMapper MAPPER = newMapper();

  /** Utility class. */
  private DrainJsonMapperProvider() {}

  /**
   * @return the shared mapper.
   */
  public static ObjectMapper getMapper() {
    return MAPPER;
  }

  /**
   * @return a writer from the shared mapper.
   */
  public static ObjectWriter getWriter() {
    return MAPPER.writer();
  }

  /**
   * @return a new mapper with drain's customizations.
   */
  private static ObjectMapper newMapper() {
    ObjectMapper mapper = new ObjectMapper();

    /* Serialize DateTimes as Strings */
    mapper.registerModule(new JodaModule());
    /* Serialize Guava types correctly */
    mapper.registerModule(new GuavaModule());
    mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    /* Don't automatically detect getters, explicit is better than implicit. */
    mapper.setVisibility(PropertyAccessor.GETTER, Visibility.NONE);
    mapper.setVisibility(PropertyAccessor.IS_GETTER, Visibility.NONE);
    mapper.setVisibility(PropertyAccessor.SETTER, Visibility.NONE);

    return mapper;
  }
}
