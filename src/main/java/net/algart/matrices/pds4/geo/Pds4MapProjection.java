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

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Values of PDS4 <code>map_projection_name</code>, which can be translated into
 * a {@link CanonicalProjection} by {@link #fromLabel fromLabel} method.
 *
 * <p>Some names (Albers Conical Equal Area, Gnomonic, etc.) are valid according to the PDS4 schematron,
 * but the schema has no dedicated element for their parameters. We suppose that the parameters
 * are stored in the element with the name of the projection (spaces replaced with underscores),
 * as for other projections.
 */
public enum Pds4MapProjection {
    EQUIRECTANGULAR("Equirectangular") {
        @Override
        boolean fromLabel(Context context, SpatialReference.Builder builder) {
            final ProjectionInputs in = context.inputs();
            builder.setProjection(CanonicalProjection.EQUIRECTANGULAR,
                    in.centerLatitude(), in.centerLongitude(), in.standardParallel1OrZero());
            return true;
        }
    },
    LAMBERT_CONFORMAL_CONIC("Lambert Conformal Conic") {
        @Override
        boolean fromLabel(Context context, SpatialReference.Builder builder) {
            final ProjectionInputs in = context.inputs();
            if (in.scale().isPresent()) {
                final double centerLat = in.centerLatitude();
                if ((in.standardParallel1().isPresent() && in.standardParallel1().getAsDouble() != centerLat)
                        || (in.standardParallel2().isPresent() && in.standardParallel2().getAsDouble() != centerLat)) {
                    context.warnings().warn("Ignoring standard_parallel_1 and/or standard_parallel_2 " +
                            "with LCC_1SP formulation");
                }
                builder.setProjection(CanonicalProjection.LAMBERT_CONFORMAL_CONIC_1SP,
                        centerLat, in.centerLongitude(), in.scaleOrDefault());
            } else {
                builder.setProjection(CanonicalProjection.LAMBERT_CONFORMAL_CONIC_2SP,
                        in.standardParallel1OrZero(), in.standardParallel2OrZero(),
                        in.centerLatitude(), in.centerLongitude());
            }
            return true;
        }
    },
    OBLIQUE_MERCATOR("Oblique Mercator") {
        @Override
        boolean fromLabel(Context context, SpatialReference.Builder builder) {
            final ProjectionInputs in = context.inputs();
            final LabelTree tree = context.tree();
            final LabelQuantities quantities = context.quantities();
            final int azimuth = tree.find(in.parameterNode(), "Oblique_Line_Azimuth");
            final int point = tree.find(in.parameterNode(), "Oblique_Line_Point");
            if (azimuth != LabelTree.NONE) {
                // Angles of this block have no unit conversion
                builder.setProjection(CanonicalProjection.HOTINE_OBLIQUE_MERCATOR_AZIMUTH_CENTER,
                        in.centerLatitude(),
                        quantities.number(azimuth, "azimuth_measure_point_longitude", 0.0),
                        quantities.number(azimuth, "azimuthal_angle", 0.0),
                        in.scaleOrDefault());
                return true;
            }
            if (point != LabelTree.NONE) {
                final double[] points = new double[4];
                final List<Integer> groups = tree.childElements(point, "Oblique_Line_Point_Group");
                // Only the first two groups are used; other groups are ignored
                for (int k = 0; k < Math.min(2, groups.size()); k++) {
                    points[2 * k] = quantities.number(groups.get(k), "oblique_line_latitude", 0.0);
                    points[2 * k + 1] = quantities.number(groups.get(k), "oblique_line_longitude", 0.0);
                }
                builder.setProjection(CanonicalProjection.HOTINE_OBLIQUE_MERCATOR_TWO_POINT_NATURAL_ORIGIN,
                        in.centerLatitude(), points[0], points[1], points[2], points[3], in.scaleOrDefault());
                return true;
            }
            return false;
        }
    },
    POLAR_STEREOGRAPHIC("Polar Stereographic") {
        @Override
        boolean fromLabel(Context context, SpatialReference.Builder builder) {
            final ProjectionInputs in = context.inputs();
            builder.setProjection(CanonicalProjection.POLAR_STEREOGRAPHIC,
                    in.centerLatitude(), in.centerLongitude(), in.scaleOrDefault());
            return true;
        }
    },
    POLYCONIC("Polyconic") {
        @Override
        boolean fromLabel(Context context, SpatialReference.Builder builder) {
            return center(CanonicalProjection.POLYCONIC, context, builder);
        }
    },
    SINUSOIDAL("Sinusoidal") {
        @Override
        boolean fromLabel(Context context, SpatialReference.Builder builder) {
            builder.setProjection(CanonicalProjection.SINUSOIDAL, context.inputs().centerLongitude());
            return true;
        }
    },
    TRANSVERSE_MERCATOR("Transverse Mercator") {
        @Override
        boolean fromLabel(Context context, SpatialReference.Builder builder) {
            final ProjectionInputs in = context.inputs();
            builder.setProjection(CanonicalProjection.TRANSVERSE_MERCATOR,
                    in.centerLatitude(), in.centerLongitude(), in.scaleOrDefault());
            return true;
        }

        @Override
        public String scaleElementName() {
            return "scale_factor_at_central_meridian";
        }
    },
    ALBERS_CONICAL_EQUAL_AREA("Albers Conical Equal Area") {
        @Override
        boolean fromLabel(Context context, SpatialReference.Builder builder) {
            return conic(CanonicalProjection.ALBERS_CONIC_EQUAL_AREA, context, builder);
        }
    },
    AZIMUTHAL_EQUIDISTANT("Azimuthal Equidistant") {
        @Override
        boolean fromLabel(Context context, SpatialReference.Builder builder) {
            return center(CanonicalProjection.AZIMUTHAL_EQUIDISTANT, context, builder);
        }
    },
    EQUIDISTANT_CONIC("Equidistant Conic") {
        @Override
        boolean fromLabel(Context context, SpatialReference.Builder builder) {
            return conic(CanonicalProjection.EQUIDISTANT_CONIC, context, builder);
        }
    },
    GNOMONIC("Gnomonic") {
        @Override
        boolean fromLabel(Context context, SpatialReference.Builder builder) {
            return center(CanonicalProjection.GNOMONIC, context, builder);
        }
    },
    LAMBERT_AZIMUTHAL_EQUAL_AREA("Lambert Azimuthal Equal Area") {
        @Override
        boolean fromLabel(Context context, SpatialReference.Builder builder) {
            return center(CanonicalProjection.LAMBERT_AZIMUTHAL_EQUAL_AREA, context, builder);
        }
    },
    MILLER_CYLINDRICAL("Miller Cylindrical") {
        @Override
        boolean fromLabel(Context context, SpatialReference.Builder builder) {
            return center(CanonicalProjection.MILLER_CYLINDRICAL, context, builder);
        }
    },
    ORTHOGRAPHIC("Orthographic", "Orothographic") {
        @Override
        boolean fromLabel(Context context, SpatialReference.Builder builder) {
            return center(CanonicalProjection.ORTHOGRAPHIC, context, builder);
        }
    },
    ROBINSON("Robinson") {
        @Override
        boolean fromLabel(Context context, SpatialReference.Builder builder) {
            builder.setProjection(CanonicalProjection.ROBINSON, context.inputs().centerLongitude());
            return true;
        }
    },
    STEREOGRAPHIC("Stereographic") {
        @Override
        boolean fromLabel(Context context, SpatialReference.Builder builder) {
            final ProjectionInputs in = context.inputs();
            builder.setProjection(CanonicalProjection.STEREOGRAPHIC,
                    in.centerLatitude(), in.centerLongitude(), in.scaleOrDefault());
            return true;
        }
    },
    VAN_DER_GRINTEN("van der Grinten") {
        @Override
        boolean fromLabel(Context context, SpatialReference.Builder builder) {
            builder.setProjection(CanonicalProjection.VAN_DER_GRINTEN, context.inputs().centerLongitude());
            return true;
        }
    },
    MERCATOR("Mercator") {
        @Override
        boolean fromLabel(Context context, SpatialReference.Builder builder) {
            final ProjectionInputs in = context.inputs();
            if (in.standardParallel1().isPresent() && in.scale().isEmpty()) {
                builder.setProjection(CanonicalProjection.MERCATOR_2SP,
                        in.standardParallel1OrZero(), in.centerLatitude(), in.centerLongitude());
            } else {
                builder.setProjection(CanonicalProjection.MERCATOR_1SP,
                        in.centerLatitude(), in.centerLongitude(), in.scaleOrDefault());
            }
            return true;
        }
    };

    /**
     * The way of building the ellipsoid from the PDS4 geodetic model.
     */
    public enum EllipsoidPolicy {
        /**
         * Polar aspect: the full ellipsoid for planetographic latitudes, else a sphere with the polar radius.
         */
        POLAR,
        /**
         * Sphere with the semi-major radius, regardless of the latitude type.
         */
        SPHERE,
        /**
         * The full ellipsoid for planetographic latitudes, else a sphere with the semi-major radius.
         */
        BY_LATITUDE_TYPE
    }

    record Context(LabelTree tree, LabelQuantities quantities, ProjectionInputs inputs, Pds4Warnings warnings) {
        Context {
            Objects.requireNonNull(tree, "Null tree");
            Objects.requireNonNull(quantities, "Null quantities");
            Objects.requireNonNull(inputs, "Null inputs");
            Objects.requireNonNull(warnings, "Null warnings");
        }
    }

    private final String pdsName;
    private final String alias;

    Pds4MapProjection(String pdsName) {
        this(pdsName, null);
    }

    Pds4MapProjection(String pdsName, String alias) {
        this.pdsName = pdsName;
        this.alias = alias;
    }

    public String pdsName() {
        return pdsName;
    }

    /**
     * Name of the element inside the parameter block, containing the scale factor.
     *
     * @return element name.
     */
    public String scaleElementName() {
        return "scale_factor_at_projection_origin";
    }

    public EllipsoidPolicy ellipsoidPolicy(double centerLatitude) {
        return switch (this) {
            case POLAR_STEREOGRAPHIC -> EllipsoidPolicy.POLAR;
            case STEREOGRAPHIC -> Math.abs(centerLatitude) == 90.0 ? EllipsoidPolicy.POLAR : EllipsoidPolicy.SPHERE;
            case EQUIRECTANGULAR, ORTHOGRAPHIC, SINUSOIDAL -> EllipsoidPolicy.SPHERE;
            default -> EllipsoidPolicy.BY_LATITUDE_TYPE;
        };
    }

    /**
     * Finds the parameter element of this projection inside <code>Map_Projection</code> element.
     *
     * @param tree          label tree.
     * @param mapProjection <code>Map_Projection</code> element.
     * @param declaredName  the value of <code>map_projection_name</code>.
     * @return the parameter element or {@link LabelTree#NONE}.
     */
    public int findParameterNode(LabelTree tree, int mapProjection, String declaredName) {
        Objects.requireNonNull(tree, "Null tree");
        Objects.requireNonNull(declaredName, "Null declaredName");
        final int result = tree.find(mapProjection, declaredName.replace(' ', '_'));
        if (result == LabelTree.NONE && !declaredName.equals(pdsName)) {
            return tree.find(mapProjection, pdsName.replace(' ', '_'));
        }
        return result;
    }

    /**
     * Sets the canonical projection, corresponding to this PDS4 projection and the label parameters.
     *
     * @param context label and the parameters read from it.
     * @param builder builder of the result.
     * @return <code>false</code> if the label does not contain enough information for this projection.
     */
    abstract boolean fromLabel(Context context, SpatialReference.Builder builder);

    public static Optional<Pds4MapProjection> fromPdsName(String name) {
        Objects.requireNonNull(name, "Null name");
        for (Pds4MapProjection projection : values()) {
            if (projection.pdsName.equalsIgnoreCase(name)
                    || (projection.alias != null && projection.alias.equalsIgnoreCase(name))) {
                return Optional.of(projection);
            }
        }
        return Optional.empty();
    }

    private static boolean center(
            CanonicalProjection projection,
            Context context,
            SpatialReference.Builder builder) {
        builder.setProjection(projection, context.inputs().centerLatitude(), context.inputs().centerLongitude());
        return true;
    }

    private static boolean conic(
            CanonicalProjection projection,
            Context context,
            SpatialReference.Builder builder) {
        final ProjectionInputs in = context.inputs();
        builder.setProjection(projection,
                in.standardParallel1OrZero(), in.standardParallel2OrZero(),
                in.centerLatitude(), in.centerLongitude());
        return true;
    }
}
