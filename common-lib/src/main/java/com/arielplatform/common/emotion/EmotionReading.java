package com.arielplatform.common.emotion;

/**
 * One emotion together with its current intensity.
 */
public record EmotionReading(Emotion emotion, double intensity) {}
