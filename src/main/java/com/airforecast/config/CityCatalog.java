package com.airforecast.config;

import com.airforecast.exception.UnknownCityException;
import com.airforecast.model.City;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The fixed set of monitored cities, in configuration order.
 */
@Slf4j
@Component
public class CityCatalog {

    private final Map<String, City> cities;

    public CityCatalog(ForecastProperties properties) {
        Map<String, City> byId = new LinkedHashMap<>();
        for (ForecastProperties.CityProperties c : properties.getCities()) {
            City city = new City(c.getId(), c.getName() != null ? c.getName() : c.getId(), c.getSeed());
            if (byId.putIfAbsent(city.id(), city) != null) {
                throw new IllegalStateException("City '" + city.id() + "' is configured twice");
            }
        }
        this.cities = Collections.unmodifiableMap(byId);
        log.info("City catalog loaded | cities={}", cities.keySet());
    }

    public City require(String cityId) {
        City city = cities.get(cityId);
        if (city == null) {
            throw new UnknownCityException(cityId);
        }
        return city;
    }

    public Collection<City> all() {
        return cities.values();
    }
}
