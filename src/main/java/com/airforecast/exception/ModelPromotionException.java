package com.airforecast.exception;

public class ModelPromotionException extends ForecastEngineException {
    public ModelPromotionException(String message) {
        super("MODEL_PROMOTION_ERROR", message);
    }
}
