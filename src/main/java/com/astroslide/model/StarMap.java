package com.astroslide.model;

import java.util.Collections;
import java.util.List;

/** Detection result handed from the detector to the reducer within one request. */
public class StarMap {
    public final int width;
    public final int height;
    public final double skyBackground;
    public final double noise;
    private final List<Star> stars;

    public StarMap(int width, int height, double skyBackground, double noise, List<Star> stars) {
        this.width = width;
        this.height = height;
        this.skyBackground = skyBackground;
        this.noise = noise;
        this.stars = Collections.unmodifiableList(stars);
    }

    public List<Star> getStars() { return stars; }
    public int size() { return stars.size(); }
    public boolean isEmpty() { return stars.isEmpty(); }
}
