/*
 * The MIT License (MIT)
 *
 * Copyright (c) 2023-2025 Daniel Alievsky, AlgART Laboratory (http://algart.net)
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package net.algart.matrices.pds4.geo;

import net.algart.matrices.pds4.Pds4Tools;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Canonical spatial reference system: optional projection with its named parameters,
 * geographic coordinate system (datum, ellipsoid, prime meridian) and linear units.
 *
 * <p>This class is immutable; use {@link Builder} to create instances. It can be exported to
 * and imported from WKT1 text ({@link #toWkt()}, {@link #fromWkt(String)}; Apache SIS does the WKT work)
 * and converted into proj4 parameters ({@link #toProj4()}) for reprojection.
 */
public final class SpatialReference {
    private static final double DEGREE_IN_RADIANS = Math.PI / 180.0;

    private final String projectedName;
    private final CanonicalProjection projection;
    private final Map<String, Double> parameters;
    private final GeographicCS geographicCS;
    private final double linearUnits;

    private SpatialReference(Builder builder) {
        this.projectedName = builder.projectedName;
        this.projection = builder.projection;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters));
        this.geographicCS = builder.geographicCS;
        this.linearUnits = builder.linearUnits;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public Builder toBuilder() {
        final Builder result = new Builder();
        result.projectedName = projectedName;
        result.projection = projection;
        result.parameters.putAll(parameters);
        result.geographicCS = geographicCS;
        result.linearUnits = linearUnits;
        return result;
    }

    public boolean isEmpty() {
        return projection == null && geographicCS == null;
    }

    public boolean isGeographic() {
        return projection == null && geographicCS != null;
    }

    public boolean isProjected() {
        return projection != null;
    }

    public Optional<CanonicalProjection> projection() {
        return Optional.ofNullable(projection);
    }

    public String projectedName() {
        return projectedName;
    }

    /**
     * Returns all projection parameters, including false easting/northing, in the order of setting.
     *
     * @return unmodifiable map of parameters.
     */
    public Map<String, Double> parameters() {
        return parameters;
    }

    public double parameter(String name, double defaultValue) {
        Objects.requireNonNull(name, "Null parameter name");
        final Double result = parameters.get(name);
        return result == null ? defaultValue : result;
    }

    public Optional<GeographicCS> geographicCS() {
        return Optional.ofNullable(geographicCS);
    }

    public double linearUnits() {
        return linearUnits;
    }

    public double semiMajor() {
        return effectiveGeographicCS().semiMajor();
    }

    public double semiMinor() {
        return effectiveGeographicCS().semiMinor();
    }

    public Optional<String> datumName() {
        return geographicCS == null ? Optional.empty() : Optional.of(geographicCS.datumName());
    }

    /**
     * Returns the geographic coordinate system of this reference as a separate (geographic) reference.
     *
     * @return geographic part of this reference or empty result if it is not specified.
     */
    public Optional<SpatialReference> geographic() {
        if (geographicCS == null) {
            return Optional.empty();
        }
        return Optional.of(newBuilder().setGeographicCS(geographicCS).build());
    }

    /**
     * Returns WKT1 text of this reference in one line; an empty reference gives an empty string.
     *
     * @return WKT text.
     * @throws IllegalStateException if the projection is not known to the WKT library.
     */
    public String toWkt() {
        return WktConverter.toWkt(this);
    }

    /**
     * Parses WKT1 text, containing <code>PROJCS</code> or <code>GEOGCS</code> root node.
     * Parameter names are stored in lower case; false easting and northing default to 0.
     *
     * @param wkt WKT text.
     * @return parsed reference.
     * @throws IllegalArgumentException if the text is not a valid WKT or contains an unknown projection.
     */
    public static SpatialReference fromWkt(String wkt) {
        Objects.requireNonNull(wkt, "Null WKT");
        if (wkt.isBlank()) {
            return newBuilder().build();
        }
        return WktConverter.fromWkt(wkt);
    }

    /**
     * Returns proj4 definition of this reference, suitable for proj4j <code>CRSFactory</code>.
     *
     * @return proj4 parameters.
     */
    public String toProj4() {
        final String ellipsoid = " +a=" + Pds4Tools.formatDouble(semiMajor())
                + " +b=" + Pds4Tools.formatDouble(semiMinor());
        if (projection == null) {
            return "+proj=longlat" + ellipsoid + " +no_defs";
        }
        final StringBuilder sb = new StringBuilder(projection.proj4(this));
        sb.append(" +x_0=").append(Pds4Tools.formatDouble(falseEasting() * linearUnits));
        sb.append(" +y_0=").append(Pds4Tools.formatDouble(falseNorthing() * linearUnits));
        sb.append(ellipsoid);
        if (linearUnits == 1.0) {
            sb.append(" +units=m");
        } else {
            sb.append(" +to_meter=").append(Pds4Tools.formatDouble(linearUnits));
        }
        return sb.append(" +no_defs").toString();
    }

    public double falseEasting() {
        return parameter(ProjectionParameter.FALSE_EASTING, 0.0);
    }

    public double falseNorthing() {
        return parameter(ProjectionParameter.FALSE_NORTHING, 0.0);
    }

    /**
     * Returns the length of 1 degree of the equator in meters.
     *
     * @return <code>semiMajor * &pi; / 180</code>.
     */
    public double degreeToMeter() {
        return semiMajor() * DEGREE_IN_RADIANS;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SpatialReference that)) {
            return false;
        }
        return Double.compare(linearUnits, that.linearUnits) == 0
                && Objects.equals(projectedName, that.projectedName)
                && projection == that.projection
                && parameters.equals(that.parameters)
                && Objects.equals(geographicCS, that.geographicCS);
    }

    @Override
    public int hashCode() {
        return Objects.hash(projectedName, projection, parameters, geographicCS, linearUnits);
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "empty spatial reference";
        }
        return (projectedName != null ? projectedName + " " : "") + "(" + toProj4() + ")";
    }

    private GeographicCS effectiveGeographicCS() {
        return geographicCS != null ? geographicCS : GeographicCS.WGS84;
    }

    public static final class Builder {
        private String projectedName = null;
        private CanonicalProjection projection = null;
        private final Map<String, Double> parameters = new LinkedHashMap<>();
        private GeographicCS geographicCS = null;
        private double linearUnits = 1.0;

        private Builder() {
        }

        public Builder setProjectedName(String projectedName) {
            this.projectedName = projectedName;
            return this;
        }

        /**
         * Sets the projection and all its parameters in the order of
         * {@link CanonicalProjection#parameterNames()}. False easting and northing are reset to 0.
         *
         * @param projection projection.
         * @param values     values of its parameters.
         * @return a reference to this object.
         */
        public Builder setProjection(CanonicalProjection projection, double... values) {
            Objects.requireNonNull(projection, "Null projection");
            Objects.requireNonNull(values, "Null values");
            final List<String> names = projection.parameterNames();
            if (values.length != names.size()) {
                throw new IllegalArgumentException("Projection " + projection + " requires " + names.size()
                        + " parameters " + names + ", but " + values.length + " passed");
            }
            this.projection = projection;
            this.parameters.clear();
            for (int k = 0; k < values.length; k++) {
                parameters.put(names.get(k), values[k]);
            }
            return setFalseOrigin(0.0, 0.0);
        }

        public Builder setParameter(String name, double value) {
            Objects.requireNonNull(name, "Null parameter name");
            parameters.put(name, value);
            return this;
        }

        public Builder setFalseOrigin(double falseEasting, double falseNorthing) {
            parameters.put(ProjectionParameter.FALSE_EASTING, falseEasting);
            parameters.put(ProjectionParameter.FALSE_NORTHING, falseNorthing);
            return this;
        }

        /**
         * Sets Transverse Mercator projection of the given UTM zone.
         *
         * @param zone  zone number 1..60.
         * @param north <code>true</code> for the northern hemisphere.
         * @return a reference to this object.
         */
        public Builder setUTM(int zone, boolean north) {
            if (zone < 1 || zone > 60) {
                throw new IllegalArgumentException("Invalid UTM zone " + zone + " (must be 1..60)");
            }
            setProjection(CanonicalProjection.TRANSVERSE_MERCATOR, 0.0, zone * 6 - 183, 0.9996);
            if (projectedName == null) {
                projectedName = String.format(Locale.US, "UTM Zone %d, %s Hemisphere",
                        zone, north ? "Northern" : "Southern");
            }
            return setFalseOrigin(500000.0, north ? 0.0 : 10000000.0);
        }

        public Builder setGeographicCS(GeographicCS geographicCS) {
            this.geographicCS = geographicCS;
            return this;
        }

        public Builder setLinearUnits(double linearUnits) {
            if (!(linearUnits > 0.0)) {
                throw new IllegalArgumentException("Linear units must be positive, but they are " + linearUnits);
            }
            this.linearUnits = linearUnits;
            return this;
        }

        public SpatialReference build() {
            if (projection == null && !parameters.isEmpty()) {
                throw new IllegalStateException("Projection parameters " + parameters
                        + " are specified without a projection");
            }
            return new SpatialReference(this);
        }
    }
}
