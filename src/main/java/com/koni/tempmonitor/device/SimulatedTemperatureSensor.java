package com.koni.tempmonitor.device;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Sensor producing a bounded random walk around a base temperature, used when no
 * physical device is attached.
 * Each read moves the value a fraction of the way back to its base and adds
 * gaussian noise, so readings drift but stay in a plausible range.
 */
public class SimulatedTemperatureSensor implements TemperatureSensor {

    private static final double AMBIENT_MIN = 15.0;
    private static final double AMBIENT_MAX = 35.0;
    private static final double OBJECT_MIN = 34.0;
    private static final double OBJECT_MAX = 41.0;

    private final double ambientBase;
    private final double objectBase;
    private double ambient;
    private double object;

    public SimulatedTemperatureSensor(double ambientBase, double objectBase) {
        this.ambientBase = clamp(ambientBase, AMBIENT_MIN, AMBIENT_MAX);
        this.objectBase = clamp(objectBase, OBJECT_MIN, OBJECT_MAX);
        this.ambient = this.ambientBase;
        this.object = this.objectBase;
    }

    /**
     * Creates a sensor with bases jittered around room and body temperature.
     */
    public static SimulatedTemperatureSensor withRandomBase() {
        ThreadLocalRandom rnd = ThreadLocalRandom.current();
        return new SimulatedTemperatureSensor(24.0 + rnd.nextDouble(-3.0, 3.0), 36.8 + rnd.nextDouble(-0.5, 0.5));
    }

    @Override
    public synchronized SensorSample read() {
        ambient = clamp(stepToward(ambient, ambientBase, 0.08, 0.12), AMBIENT_MIN, AMBIENT_MAX);
        object = clamp(stepToward(object, objectBase, 0.10, 0.05), OBJECT_MIN, OBJECT_MAX);
        return new SensorSample(round1(ambient), round1(object));
    }

    private static double stepToward(double value, double target, double k, double noiseStd) {
        double noise = ThreadLocalRandom.current().nextGaussian() * noiseStd;
        return value + k * (target - value) + noise;
    }

    private static double round1(double x) {
        return Math.round(x * 10.0) / 10.0;
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }
}
