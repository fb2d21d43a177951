package com.fieldforce.fieldexecutionbackend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * A captured location. The 0/0 reading stands for "unknown" and is what the device
 * records when no fix could be obtained.
 */
public class GeoPoint {
    private double latitude;
    private double longitude;

    public GeoPoint() {}

    public GeoPoint(double latitude, double longitude) {
        this.latitude = latitude;
        this.longitude = longitude;
    }

    public static GeoPoint unknown() {
        return new GeoPoint(0.0, 0.0);
    }

    public static GeoPoint ofNullable(Double latitude, Double longitude) {
        if (latitude == null || longitude == null) {
            return unknown();
        }
        return new GeoPoint(latitude, longitude);
    }

    public double getLatitude() { return latitude; }
    public void setLatitude(double latitude) { this.latitude = latitude; }

    public double getLongitude() { return longitude; }
    public void setLongitude(double longitude) { this.longitude = longitude; }

    @JsonIgnore
    public boolean isKnown() {
        return latitude != 0.0 || longitude != 0.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GeoPoint other = (GeoPoint) o;
        return Double.compare(latitude, other.latitude) == 0
                && Double.compare(longitude, other.longitude) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(latitude, longitude);
    }

    @Override
    public String toString() {
        return "(" + latitude + ", " + longitude + ")";
    }
}
