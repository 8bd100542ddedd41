package com.airforecast.service;

import com.airforecast.config.CityCatalog;
import com.airforecast.config.ForecastProperties;
import com.airforecast.model.City;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Random;

/**
 * Per-city seeds and the random sources derived from them.
 *
 * <p>A city's seed is its configured preset, otherwise the first 32 bits of
 * {@code md5("<cityId>_<baseSeed>")} reduced modulo {@code 2^31 - 1}. Every training run
 * gets its own {@link Random}, so concurrent runs never share generator state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReproducibilityService {

    private static final long SEED_MODULUS = 2_147_483_647L;

    private final CityCatalog cityCatalog;
    private final ForecastProperties properties;

    public long seedFor(String cityId) {
        City city = cityCatalog.require(cityId);
        if (city.presetSeed() != null) {
            return city.presetSeed();
        }
        long seed = deriveSeed(cityId, properties.getTraining().getBaseSeed());
        log.debug("Derived seed | city={} | seed={}", cityId, seed);
        return seed;
    }

    public Random newRandom(long seed) {
        return new Random(seed);
    }

    /** SHA-256 over the IEEE-754 bits of every parameter, hex encoded. */
    public String fingerprint(double[] parameters) {
        ByteBuffer buffer = ByteBuffer.allocate(parameters.length * Double.BYTES);
        for (double p : parameters) {
            buffer.putLong(Double.doubleToLongBits(p));
        }
        return HexFormat.of().formatHex(digest("SHA-256", buffer.array()));
    }

    static long deriveSeed(String cityId, long baseSeed) {
        byte[] hash = digest("MD5", (cityId + "_" + baseSeed).getBytes(StandardCharsets.UTF_8));
        String prefix = HexFormat.of().formatHex(hash, 0, 4);
        return Long.parseLong(prefix, 16) % SEED_MODULUS;
    }

    private static byte[] digest(String algorithm, byte[] input) {
        try {
            return MessageDigest.getInstance(algorithm).digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " is not available", e);
        }
    }
}
