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
import net.algart.matrices.pds4.Pds4Warnings;
import net.algart.matrices.pds4.label.LabelTree;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.Proj4jException;
import org.locationtech.proj4j.ProjCoordinate;

import java.util.Objects;

/**
 * Fills <code>Cartography</code> element of a PDS4 label by the spatial reference and north-up transform.
 *
 * <p>All created elements get the namespace prefix of the <code>Cartography</code> element itself
 * (usually <code>cart:</code>).
 */
public final class Pds4GeoreferencingWriter {
    public static final String PLANETOCENTRIC = "planetocentric";
    public static final String PLANETOGRAPHIC = "planetographic";
    public static final String POSITIVE_EAST = "Positive East";
    public static final String POSITIVE_WEST = "Positive West";

    private static final System.Logger LOG = System.getLogger(Pds4GeoreferencingWriter.class.getName());

    private static final double[] GLOBE_X = {-180.0, 180.0, -180.0, 180.0};
    private static final double[] GLOBE_Y = {90.0, 90.0, -90.0, -90.0};

    private final Pds4Warnings warnings;
    private String latitudeType = PLANETOCENTRIC;
    private String longitudeDirection = POSITIVE_EAST;
    private double[] radii = null;
    private double[] boundingDegrees = null;

    public Pds4GeoreferencingWriter(Pds4Warnings warnings) {
        this.warnings = Objects.requireNonNull(warnings, "Null warnings");
    }

    public String getLatitudeType() {
        return latitudeType;
    }

    /**
     * Sets the value of <code>latitude_type</code>. Known values are normalized to the standard case;
     * other values are written as is.
     *
     * @param latitudeType planetocentric or planetographic.
     * @return a reference to this object.
     */
    public Pds4GeoreferencingWriter setLatitudeType(String latitudeType) {
        Objects.requireNonNull(latitudeType, "Null latitudeType");
        this.latitudeType = normalize(latitudeType, PLANETOCENTRIC, PLANETOGRAPHIC);
        return this;
    }

    public String getLongitudeDirection() {
        return longitudeDirection;
    }

    public Pds4GeoreferencingWriter setLongitudeDirection(String longitudeDirection) {
        Objects.requireNonNull(longitudeDirection, "Null longitudeDirection");
        this.longitudeDirection = normalize(longitudeDirection, POSITIVE_EAST, POSITIVE_WEST);
        return this;
    }

    /**
     * Overrides the ellipsoid radii of the spatial reference.
     *
     * @param semiMajor   semi-major radius in meters.
     * @param polarRadius polar radius in meters.
     * @return a reference to this object.
     */
    public Pds4GeoreferencingWriter setRadii(double semiMajor, double polarRadius) {
        this.radii = new double[]{semiMajor, polarRadius};
        return this;
    }

    /**
     * Overrides the bounding coordinates, which are calculated by default by reprojecting the image corners.
     *
     * @param west  west bounding longitude.
     * @param south south bounding latitude.
     * @param east  east bounding longitude.
     * @param north north bounding latitude.
     * @return a reference to this object.
     */
    public Pds4GeoreferencingWriter setBoundingDegrees(double west, double south, double east, double north) {
        this.boundingDegrees = new double[]{west, south, east, north};
        return this;
    }

    public void write(
            LabelTree tree,
            int cartography,
            SpatialReference srs,
            GeoTransform transform,
            long sizeX,
            long sizeY) {
        Objects.requireNonNull(tree, "Null tree");
        Objects.requireNonNull(srs, "Null spatial reference");
        Objects.requireNonNull(transform, "Null transform");
        transform.requireNorthUp();
        if (sizeX <= 0 || sizeY <= 0) {
            throw new IllegalArgumentException("Zero or negative image sizes " + sizeX + "x" + sizeY);
        }
        final String prefix = Pds4Tools.prefixOf(tree.name(cartography));
        final Elements e = new Elements(tree, prefix);

        writeBoundingCoordinates(e, cartography, srs, transform, sizeX, sizeY);

        final int definition = e.add(e.add(cartography, "Spatial_Reference_Information"),
                "Horizontal_Coordinate_System_Definition");
        final int planar = e.add(definition, "Planar");
        writeMapProjection(e, e.add(planar, "Map_Projection"), srs);

        final int information = e.add(planar, "Planar_Coordinate_Information");
        e.add(information, "planar_coordinate_encoding_method", "Coordinate Pair");
        final int representation = e.add(information, "Coordinate_Representation");
        final double degreeToMeter = srs.degreeToMeter();
        final double pixelWidth = transform.pixelWidth();
        final double pixelHeight = -transform.pixelHeight();
        final boolean geographic = srs.isGeographic();
        final double units = geographic ? degreeToMeter : srs.linearUnits();
        e.add(representation, "pixel_resolution_x", pixelWidth * units, "m/pixel");
        e.add(representation, "pixel_resolution_y", pixelHeight * units, "m/pixel");
        e.add(representation, "pixel_scale_x",
                geographic ? 1.0 / pixelWidth : degreeToMeter / (pixelWidth * units), "pixel/deg");
        e.add(representation, "pixel_scale_y",
                geographic ? 1.0 / pixelHeight : degreeToMeter / (pixelHeight * units), "pixel/deg");

        final int transformation = e.add(planar, "Geo_Transformation");
        // Center of the upper-left pixel, relative to the false origin
        final double upperLeftX = -srs.falseEasting() + transform.originX() + 0.5 * transform.pixelWidth();
        final double upperLeftY = -srs.falseNorthing() + transform.originY() + 0.5 * transform.pixelHeight();
        e.add(transformation, "upperleft_corner_x", upperLeftX * units, "m");
        e.add(transformation, "upperleft_corner_y", upperLeftY * units, "m");

        writeGeodeticModel(e, e.add(definition, "Geodetic_Model"), srs);
    }

    private void writeBoundingCoordinates(
            Elements e,
            int cartography,
            SpatialReference srs,
            GeoTransform transform,
            long sizeX,
            long sizeY) {
        final double left = transform.x(0.5, 0.0);
        final double right = transform.x(sizeX - 0.5, 0.0);
        final double top = transform.y(0.0, 0.5);
        final double bottom = transform.y(0.0, sizeY - 0.5);
        double[] x = {left, right, left, right};
        double[] y = {top, top, bottom, bottom};
        if (!srs.isGeographic() && !reprojectToGeographic(srs, x, y)) {
            x = GLOBE_X.clone();
            y = GLOBE_Y.clone();
        }
        double west = Math.min(Math.min(x[0], x[1]), Math.min(x[2], x[3]));
        double east = Math.max(Math.max(x[0], x[1]), Math.max(x[2], x[3]));
        double north = Math.max(Math.max(y[0], y[1]), Math.max(y[2], y[3]));
        double south = Math.min(Math.min(y[0], y[1]), Math.min(y[2], y[3]));
        if (boundingDegrees != null) {
            west = boundingDegrees[0];
            south = boundingDegrees[1];
            east = boundingDegrees[2];
            north = boundingDegrees[3];
        }
        final int bounding = e.add(e.add(cartography, "Spatial_Domain"), "Bounding_Coordinates");
        e.add(bounding, "west_bounding_coordinate", west, LabelProjection.DEGREE);
        e.add(bounding, "east_bounding_coordinate", east, LabelProjection.DEGREE);
        e.add(bounding, "north_bounding_coordinate", north, LabelProjection.DEGREE);
        e.add(bounding, "south_bounding_coordinate", south, LabelProjection.DEGREE);
    }

    private void writeMapProjection(Elements e, int mapProjection, SpatialReference srs) {
        final LabelProjection projection;
        if (srs.isProjected()) {
            final CanonicalProjection canonical = srs.projection().orElseThrow();
            projection = canonical.toLabel(srs).orElseGet(() -> {
                warnings.warn("Projection %s not supported", canonical.wktName());
                return LabelProjection.empty();
            });
        } else {
            // - geographic coordinates are written as the simplest equirectangular projection
            projection = LabelProjection.newBuilder("Equirectangular")
                    .angle("longitude_of_central_meridian", 0.0)
                    .angle("latitude_of_projection_origin", 0.0)
                    .build();
        }
        e.add(mapProjection, "map_projection_name", projection.name());
        if (projection.isEmpty()) {
            return;
        }
        final int parameters = e.add(mapProjection, projection.parametersElementName());
        for (LabelProjection.Parameter parameter : projection.parameters()) {
            writeParameter(e, parameters, parameter);
        }
    }

    private void writeParameter(Elements e, int parent, LabelProjection.Parameter parameter) {
        if (parameter.isGroup()) {
            final int group = e.add(parent, parameter.name());
            for (LabelProjection.Parameter child : parameter.children()) {
                writeParameter(e, group, child);
            }
        } else {
            e.add(parent, parameter.name(), parameter.value(), parameter.unit());
        }
    }

    private void writeGeodeticModel(Elements e, int model, SpatialReference srs) {
        e.add(model, "latitude_type", latitudeType);
        srs.datumName().ifPresent(datum ->
                e.add(model, "spheroid_name", datum.startsWith("D_") ? datum.substring(2) : datum));
        final double semiMajor = radii != null ? radii[0] : srs.semiMajor();
        final double polarRadius = radii != null ? radii[1] : srs.semiMinor();
        e.add(model, "semi_major_radius", semiMajor, "m");
        // PDS4 semi_minor_radius is the second radius in the equatorial plane, not the polar one
        e.add(model, "semi_minor_radius", semiMajor, "m");
        e.add(model, "polar_radius", polarRadius, "m");
        e.add(model, "longitude_direction", longitudeDirection);
    }

    private static boolean reprojectToGeographic(SpatialReference srs, double[] x, double[] y) {
        final CRSFactory factory = new CRSFactory();
        try {
            final CoordinateReferenceSystem source = factory.createFromParameters("source", srs.toProj4());
            final CoordinateReferenceSystem target = factory.createFromParameters("geographic",
                    srs.geographic().orElseGet(() -> SpatialReference.newBuilder()
                            .setGeographicCS(GeographicCS.WGS84).build()).toProj4());
            final CoordinateTransform transform = new CoordinateTransformFactory().createTransform(source, target);
            final ProjCoordinate src = new ProjCoordinate();
            final ProjCoordinate dst = new ProjCoordinate();
            for (int k = 0; k < x.length; k++) {
                src.x = x[k];
                src.y = y[k];
                transform.transform(src, dst);
                if (!Double.isFinite(dst.x) || !Double.isFinite(dst.y)) {
                    LOG.log(System.Logger.Level.DEBUG, "Corner (" + x[k] + ", " + y[k] + ") cannot be reprojected");
                    return false;
                }
                x[k] = dst.x;
                y[k] = dst.y;
            }
            return true;
        } catch (Proj4jException e) {
            LOG.log(System.Logger.Level.DEBUG, "Cannot reproject corners to geographic coordinates: "
                    + e.getMessage(), e);
            return false;
        }
    }

    private static String normalize(String value, String... knownValues) {
        for (String known : knownValues) {
            if (known.equalsIgnoreCase(value)) {
                return known;
            }
        }
        return value;
    }

    private record Elements(LabelTree tree, String prefix) {
        int add(int parent, String name) {
            return tree.addElement(parent, prefix + name);
        }

        int add(int parent, String name, String text) {
            return tree.addElement(parent, prefix + name, text);
        }

        void add(int parent, String name, double value, String unit) {
            final int element = tree.addElement(parent, prefix + name, Pds4Tools.formatDouble(value));
            if (unit != null) {
                tree.setAttribute(element, "unit", unit);
            }
        }
    }
}
