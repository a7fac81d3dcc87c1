package com.gentoro.twinsync.model;

import com.gentoro.twinsync.exception.ValidationException;
import java.util.Objects;

/** A twin in the twin graph: id, model and the model's property variant. */
public record Twin(String twinId, TwinModel model, TwinProperties properties) {

  public Twin {
    Objects.requireNonNull(twinId, "twinId");
    Objects.requireNonNull(model, "model");
    Objects.requireNonNull(properties, "properties");
    boolean matches =
        (model == TwinModel.NODE && properties instanceof NodeTwinProperties)
            || (model == TwinModel.TIMESERIES && properties instanceof TimeseriesTwinProperties);
    if (!matches) {
      throw new ValidationException(
          "Properties "
              + properties.getClass().getSimpleName()
              + " do not belong to model "
              + model);
    }
  }

  public static Twin node(String twinId, NodeTwinProperties properties) {
    return new Twin(twinId, TwinModel.NODE, properties);
  }

  public static Twin timeseries(String twinId, TimeseriesTwinProperties properties) {
    return new Twin(twinId, TwinModel.TIMESERIES, properties);
  }

  public boolean isNode() {
    return model == TwinModel.NODE;
  }

  public boolean isTimeseries() {
    return model == TwinModel.TIMESERIES;
  }
}
