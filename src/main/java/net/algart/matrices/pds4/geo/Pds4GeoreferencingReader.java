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

import net.algart.matrices.pds4.Pds4Warnings;
import net.algart.matrices.pds4.label.LabelTree;

import java.util.Objects;
import java.util.Optional;

/**
 * Reads georeferencing from <code>Observation_Area.Discipline_Area.Cartography</code> element
 * of a namespace-stripped PDS4 label.
 *
 * <p>All problems are reported as warnings: a malformed or absent cartography never prevents
 * reading the raster itself.
 */
public final class Pds4GeoreferencingReader {
    public static final String CARTOGRAPHY_PATH = "Observation_Area.Discipline_Area.Cartography";

    private static final System.Logger LOG = System.getLogger(Pds4GeoreferencingReader.class.getName());

    private static final String UTM_NAME = "Universal Transverse Mercator";
    private static final String UPS_NAME = "Universal Polar Stereographic";
    private static final double MIN_FLATTENING_DIFFERENCE = 1e-8;

    private final Pds4Warnings warnings;

    public Pds4GeoreferencingReader(Pds4Warnings warnings) {
        this.warnings = Objects.requireNonNull(warnings, "Null warnings");
    }

    /**
     * Reads georeferencing of the product.
     *
     * @param tree    namespace-stripped label.
     * @param product <code>Product_Observational</code> element.
     * @return spatial reference and transform; empty result if the label has no cartography.
     */
    public Pds4Georeferencing read(LabelTree tree, int product) {
        Objects.requireNonNull(tree, "Null tree");
        final int cartography = tree.find(product, CARTOGRAPHY_PATH);
        if (cartography == LabelTree.NONE) {
            LOG.log(System.Logger.Level.DEBUG, "Did not find " + CARTOGRAPHY_PATH);
            return Pds4Georeferencing.empty();
        }
        final LabelQuantities quantities = new LabelQuantities(tree, warnings);
        logBoundingBox(tree, cartography);
        final int definition = tree.find(cartography,
                "Spatial_Reference_Information.Horizontal_Coordinate_System_Definition");
        if (definition == LabelTree.NONE) {
            LOG.log(System.Logger.Level.DEBUG,
                    "Did not find Spatial_Reference_Information.Horizontal_Coordinate_System_Definition");
            return Pds4Georeferencing.empty();
        }

        final SpatialReference.Builder builder = SpatialReference.newBuilder();
        String projectionName = "";
        Pds4MapProjection.EllipsoidPolicy ellipsoidPolicy = Pds4MapProjection.EllipsoidPolicy.BY_LATITUDE_TYPE;
        final int grid = tree.find(definition, "Planar.Grid_Coordinate_System");
        final int mapProjection = tree.find(definition, "Planar.Map_Projection");
        if (grid != LabelTree.NONE) {
            projectionName = tree.value(grid, "grid_coordinate_system_name", "");
            if (!projectionName.isEmpty()) {
                readGridCoordinateSystem(tree, quantities, grid, projectionName, builder);
            }
        } else if (mapProjection != LabelTree.NONE) {
            projectionName = tree.value(mapProjection, "map_projection_name", "");
            if (!projectionName.isEmpty()) {
                final Optional<Pds4MapProjection> projection = Pds4MapProjection.fromPdsName(projectionName);
                if (projection.isPresent()) {
                    final Pds4MapProjection p = projection.get();
                    final int parameters = p.findParameterNode(tree, mapProjection, projectionName);
                    final ProjectionInputs inputs = ProjectionInputs.read(
                            quantities, tree, parameters, p.scaleElementName());
                    if (!p.fromLabel(new Pds4MapProjection.Context(tree, quantities, inputs, warnings), builder)) {
                        warnings.warn("map_projection_name = %s not supported", projectionName);
                    }
                    projectionName = p.pdsName();
                    ellipsoidPolicy = p.ellipsoidPolicy(inputs.centerLatitude());
                } else {
                    warnings.warn("map_projection_name = %s not supported", projectionName);
                }
            }
        } else {
            warnings.warn("Planar.Map_Projection not found");
        }

        final int geodeticModel = tree.find(definition, "Geodetic_Model");
        if (geodeticModel != LabelTree.NONE) {
            readGeodeticModel(tree, quantities, product, geodeticModel, projectionName, ellipsoidPolicy, builder);
        }
        final SpatialReference srs = builder.build();
        final Optional<GeoTransform> transform = readTransform(tree, quantities, definition);
        return new Pds4Georeferencing(srs.isEmpty() ? Optional.empty() : Optional.of(srs), transform);
    }

    private void readGridCoordinateSystem(
            LabelTree tree,
            LabelQuantities quantities,
            int grid,
            String name,
            SpatialReference.Builder builder) {
        switch (name) {
            case UTM_NAME -> {
                final String zoneText = tree.value(grid, "Universal_Transverse_Mercator.utm_zone_number", null);
                if (zoneText == null) {
                    return;
                }
                final int zone;
                try {
                    zone = Integer.parseInt(zoneText.trim());
                } catch (NumberFormatException e) {
                    warnings.warn("Invalid utm_zone_number %s", zoneText);
                    return;
                }
                if (zone == 0 || Math.abs(zone) > 60) {
                    warnings.warn("Invalid utm_zone_number %s", zoneText);
                    return;
                }
                builder.setUTM(Math.abs(zone), zone > 0);
            }
            case UPS_NAME -> {
                final int parameters = tree.find(grid, "Universal_Polar_Stereographic.Polar_Stereographic");
                if (parameters != LabelTree.NONE) {
                    final ProjectionInputs inputs = ProjectionInputs.read(
                            quantities, tree, parameters, "scale_factor_at_projection_origin");
                    builder.setProjection(CanonicalProjection.POLAR_STEREOGRAPHIC,
                            inputs.centerLatitude(), inputs.centerLongitude(), inputs.scaleOrDefault());
                }
            }
            default -> warnings.warn("grid_coordinate_system_name = %s not supported", name);
        }
    }

    private void readGeodeticModel(
            LabelTree tree,
            LabelQuantities quantities,
            int product,
            int geodeticModel,
            String projectionName,
            Pds4MapProjection.EllipsoidPolicy ellipsoidPolicy,
            SpatialReference.Builder builder) {
        final boolean planetographic = tree.value(geodeticModel, "latitude_type", "")
                .equalsIgnoreCase("planetographic");
        final double semiMajor = quantities.linear(geodeticModel, "semi_major_radius");
        // semi_minor_radius lies in the equatorial plane; polar_radius is the real minor axis
        final double equatorialMinor = quantities.linear(geodeticModel, "semi_minor_radius");
        if (semiMajor != equatorialMinor) {
            warnings.warn("semi_minor_radius = %f m, different from semi_major_radius = %f, will be ignored",
                    equatorialMinor, semiMajor);
        }
        final double polarRadius = quantities.linear(geodeticModel, "polar_radius");

        final String target = tree.value(product, "Observation_Area.Target_Identification.name", "unknown");
        builder.setProjectedName(projectionName + " " + target);
        final String geographicName = "GCS_" + target;
        final String spheroidName = tree.value(geodeticModel, "spheroid_name", target);
        final String datumName = "D_" + spheroidName;
        final double inverseFlattening = semiMajor - polarRadius >= MIN_FLATTENING_DIFFERENCE ?
                semiMajor / (semiMajor - polarRadius) :
                0.0;
        final GeographicCS cs = switch (ellipsoidPolicy) {
            case POLAR -> planetographic ?
                    new GeographicCS(geographicName, datumName, spheroidName, semiMajor, inverseFlattening,
                            GeographicCS.REFERENCE_MERIDIAN, 0.0) :
                    GeographicCS.sphere(geographicName, datumName, spheroidName + "_polarRadius", polarRadius);
            case SPHERE -> GeographicCS.sphere(geographicName, datumName, spheroidName, semiMajor);
            case BY_LATITUDE_TYPE -> planetographic ?
                    new GeographicCS(geographicName, datumName, spheroidName, semiMajor, inverseFlattening,
                            GeographicCS.REFERENCE_MERIDIAN, 0.0) :
                    GeographicCS.sphere(geographicName, datumName, spheroidName, semiMajor);
        };
        builder.setGeographicCS(cs);
    }

    private Optional<GeoTransform> readTransform(
            LabelTree tree,
            LabelQuantities quantities,
            int definition) {
        final int information = tree.find(definition, "Planar.Planar_Coordinate_Information");
        final int transformation = tree.find(definition, "Planar.Geo_Transformation");
        if (information == LabelTree.NONE || transformation == LabelTree.NONE) {
            return Optional.empty();
        }
        final String encoding = tree.value(information, "planar_coordinate_encoding_method", "");
        final int representation = tree.find(information, "Coordinate_Representation");
        if (!encoding.equalsIgnoreCase("Coordinate Pair")) {
            warnings.warn("planar_coordinate_encoding_method = %s not supported", encoding);
            return Optional.empty();
        }
        if (representation == LabelTree.NONE) {
            return Optional.empty();
        }
        final double resolutionX = quantities.resolution(representation, "pixel_resolution_x");
        final double resolutionY = quantities.resolution(representation, "pixel_resolution_y");
        // - the label stores the center of the upper-left pixel
        final double upperLeftX = quantities.linear(transformation, "upperleft_corner_x");
        final double upperLeftY = quantities.linear(transformation, "upperleft_corner_y");
        return Optional.of(new GeoTransform(
                upperLeftX - 0.5 * resolutionX, resolutionX, 0.0,
                upperLeftY + 0.5 * resolutionY, 0.0, -resolutionY));
    }

    private static void logBoundingBox(LabelTree tree, int cartography) {
        final int bounding = tree.find(cartography, "Spatial_Domain.Bounding_Coordinates");
        if (bounding == LabelTree.NONE || !LOG.isLoggable(System.Logger.Level.DEBUG)) {
            return;
        }
        for (String side : new String[]{"west", "east", "north", "south"}) {
            final String value = tree.value(bounding, side + "_bounding_coordinate", null);
            if (value != null) {
                LOG.log(System.Logger.Level.DEBUG, side + ": " + value);
            }
        }
    }
}
