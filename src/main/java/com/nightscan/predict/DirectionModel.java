package com.nightscan.predict;

import com.nightscan.model.DirectionForecast;
import com.nightscan.model.PriceSeries;

/**
 * Price-direction model. {@link #refresh} fits (or re-fits) the model for a symbol; {@link #predict} only uses a
 * model that was actually fitted and otherwise reports {@code modelTrained = false}.
 */
public interface DirectionModel {

    String name();

    /**
     * @return true when a model for {@code symbol} was fitted
     */
    boolean refresh(String symbol, PriceSeries history);

    DirectionForecast predict(String symbol, PriceSeries history);
}
