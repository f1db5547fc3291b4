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

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static net.algart.matrices.pds4.geo.ProjectionParameter.*;

/**
 * Projections of the canonical spatial reference model, named as in WKT <code>PROJECTION</code> node.
 *
 * <p>Every projection knows its parameters, its proj4 definition and the way to write it
 * into a PDS4 label by {@link #toLabel(SpatialReference)}.
 * Some projections can be read from PDS4 labels, but have no PDS4 representation for writing:
 * for them {@link #toLabel(SpatialReference)} returns an empty result.
 */
public enum CanonicalProjection {
    EQUIRECTANGULAR("Equirectangular",
            "+proj=eqc +lat_ts={standard_parallel_1} +lat_0={latitude_of_origin} +lon_0={central_meridian}",
            LATITUDE_OF_ORIGIN, CENTRAL_MERIDIAN, STANDARD_PARALLEL_1) {
        @Override
        public Optional<LabelProjection> toLabel(SpatialReference srs) {
            return Optional.of(LabelProjection.newBuilder("Equirectangular")
                    .angle("standard_parallel_1", srs.parameter(STANDARD_PARALLEL_1, 1.0))
                    .angle("longitude_of_central_meridian", srs.parameter(CENTRAL_MERIDIAN, 0.0))
                    .angle("latitude_of_projection_origin", srs.parameter(LATITUDE_OF_ORIGIN, 0.0))
                    .build());
        }
    },
    LAMBERT_CONFORMAL_CONIC_1SP("Lambert_Conformal_Conic_1SP",
            "+proj=lcc +lat_1={latitude_of_origin} +lat_0={latitude_of_origin} +lon_0={central_meridian} "
                    + "+k_0={scale_factor}",
            LATITUDE_OF_ORIGIN, CENTRAL_MERIDIAN, SCALE_FACTOR) {
        @Override
        public Optional<LabelProjection> toLabel(SpatialReference srs) {
            return Optional.of(LabelProjection.newBuilder("Lambert Conformal Conic")
                    .scale("scale_factor_at_projection_origin", srs.parameter(SCALE_FACTOR, 1.0))
                    .angle("longitude_of_central_meridian", srs.parameter(CENTRAL_MERIDIAN, 0.0))
                    .angle("latitude_of_projection_origin", srs.parameter(LATITUDE_OF_ORIGIN, 0.0))
                    .build());
        }
    },
    LAMBERT_CONFORMAL_CONIC_2SP("Lambert_Conformal_Conic_2SP",
            "+proj=lcc +lat_1={standard_parallel_1} +lat_2={standard_parallel_2} +lat_0={latitude_of_origin} "
                    + "+lon_0={central_meridian}",
            STANDARD_PARALLEL_1, STANDARD_PARALLEL_2, LATITUDE_OF_ORIGIN, CENTRAL_MERIDIAN) {
        @Override
        public Optional<LabelProjection> toLabel(SpatialReference srs) {
            return Optional.of(LabelProjection.newBuilder("Lambert Conformal Conic")
                    .angle("standard_parallel_1", srs.parameter(STANDARD_PARALLEL_1, 0.0))
                    .angle("standard_parallel_2", srs.parameter(STANDARD_PARALLEL_2, 0.0))
                    .angle("longitude_of_central_meridian", srs.parameter(CENTRAL_MERIDIAN, 0.0))
                    .angle("latitude_of_projection_origin", srs.parameter(LATITUDE_OF_ORIGIN, 0.0))
                    .build());
        }
    },
    HOTINE_OBLIQUE_MERCATOR_AZIMUTH_CENTER("Hotine_Oblique_Mercator_Azimuth_Center",
            "+proj=omerc +lat_0={latitude_of_center} +lonc={longitude_of_center} +alpha={azimuth} "
                    + "+k={scale_factor}",
            LATITUDE_OF_CENTER, LONGITUDE_OF_CENTER, AZIMUTH, SCALE_FACTOR) {
        @Override
        public Optional<LabelProjection> toLabel(SpatialReference srs) {
            return Optional.of(LabelProjection.newBuilder("Oblique Mercator")
                    .scale("scale_factor_at_projection_origin", srs.parameter(SCALE_FACTOR, 0.0))
                    .group("Oblique_Line_Azimuth",
                            LabelProjection.Parameter.angle("azimuthal_angle", srs.parameter(AZIMUTH, 0.0)),
                            LabelProjection.Parameter.angle("azimuth_measure_point_longitude",
                                    srs.parameter(LONGITUDE_OF_CENTER, 0.0)))
                    .angle("latitude_of_projection_origin", srs.parameter(LATITUDE_OF_CENTER, 0.0))
                    .build());
        }
    },
    HOTINE_OBLIQUE_MERCATOR_TWO_POINT_NATURAL_ORIGIN("Hotine_Oblique_Mercator_Two_Point_Natural_Origin",
            "+proj=omerc +lat_0={latitude_of_center} +lat_1={latitude_of_point_1} +lon_1={longitude_of_point_1} "
                    + "+lat_2={latitude_of_point_2} +lon_2={longitude_of_point_2} +k={scale_factor}",
            LATITUDE_OF_CENTER, LATITUDE_OF_POINT_1, LONGITUDE_OF_POINT_1, LATITUDE_OF_POINT_2, LONGITUDE_OF_POINT_2,
            SCALE_FACTOR) {
        @Override
        public Optional<LabelProjection> toLabel(SpatialReference srs) {
            return Optional.of(LabelProjection.newBuilder("Oblique Mercator")
                    .scale("scale_factor_at_projection_origin", srs.parameter(SCALE_FACTOR, 0.0))
                    .group("Oblique_Line_Point",
                            LabelProjection.Parameter.group("Oblique_Line_Point_Group",
                                    LabelProjection.Parameter.angle("oblique_line_latitude",
                                            srs.parameter(LATITUDE_OF_POINT_1, 0.0)),
                                    LabelProjection.Parameter.angle("oblique_line_longitude",
                                            srs.parameter(LONGITUDE_OF_POINT_1, 0.0))),
                            LabelProjection.Parameter.group("Oblique_Line_Point_Group",
                                    LabelProjection.Parameter.angle("oblique_line_latitude",
                                            srs.parameter(LATITUDE_OF_POINT_2, 0.0)),
                                    LabelProjection.Parameter.angle("oblique_line_longitude",
                                            srs.parameter(LONGITUDE_OF_POINT_2, 0.0))))
                    .angle("latitude_of_projection_origin", srs.parameter(LATITUDE_OF_CENTER, 0.0))
                    .build());
        }
    },
    POLAR_STEREOGRAPHIC("Polar_Stereographic",
            "+proj=stere +lat_0={pole} +lat_ts={latitude_of_origin} +lon_0={central_meridian} +k={scale_factor}",
            LATITUDE_OF_ORIGIN, CENTRAL_MERIDIAN, SCALE_FACTOR) {
        @Override
        public Optional<LabelProjection> toLabel(SpatialReference srs) {
            return Optional.of(LabelProjection.newBuilder("Polar Stereographic")
                    .angle("straight_vertical_longitude_from_pole", srs.parameter(CENTRAL_MERIDIAN, 0.0))
                    .scale("scale_factor_at_projection_origin", srs.parameter(SCALE_FACTOR, 1.0))
                    .angle("latitude_of_projection_origin", srs.parameter(LATITUDE_OF_ORIGIN, 0.0))
                    .build());
        }
    },
    POLYCONIC("Polyconic",
            "+proj=poly +lat_0={latitude_of_origin} +lon_0={central_meridian}",
            LATITUDE_OF_ORIGIN, CENTRAL_MERIDIAN) {
        @Override
        public Optional<LabelProjection> toLabel(SpatialReference srs) {
            return centerOnly("Polyconic", srs);
        }
    },
    SINUSOIDAL("Sinusoidal",
            "+proj=sinu +lon_0={central_meridian}",
            CENTRAL_MERIDIAN) {
        @Override
        public Optional<LabelProjection> toLabel(SpatialReference srs) {
            return centerOnly("Sinusoidal", srs);
        }
    },
    TRANSVERSE_MERCATOR("Transverse_Mercator",
            "+proj=tmerc +lat_0={latitude_of_origin} +lon_0={central_meridian} +k={scale_factor}",
            LATITUDE_OF_ORIGIN, CENTRAL_MERIDIAN, SCALE_FACTOR) {
        @Override
        public Optional<LabelProjection> toLabel(SpatialReference srs) {
            return Optional.of(LabelProjection.newBuilder("Transverse Mercator")
                    .scale("scale_factor_at_central_meridian", srs.parameter(SCALE_FACTOR, 1.0))
                    .angle("longitude_of_central_meridian", srs.parameter(CENTRAL_MERIDIAN, 0.0))
                    .angle("latitude_of_projection_origin", srs.parameter(LATITUDE_OF_ORIGIN, 0.0))
                    .build());
        }
    },
    ALBERS_CONIC_EQUAL_AREA("Albers_Conic_Equal_Area",
            "+proj=aea +lat_1={standard_parallel_1} +lat_2={standard_parallel_2} +lat_0={latitude_of_center} "
                    + "+lon_0={longitude_of_center}",
            STANDARD_PARALLEL_1, STANDARD_PARALLEL_2, LATITUDE_OF_CENTER, LONGITUDE_OF_CENTER) {
        @Override
        public Optional<LabelProjection> toLabel(SpatialReference srs) {
            return Optional.empty();
        }
    },
    AZIMUTHAL_EQUIDISTANT("Azimuthal_Equidistant",
            "+proj=aeqd +lat_0={latitude_of_center} +lon_0={longitude_of_center}",
            LATITUDE_OF_CENTER, LONGITUDE_OF_CENTER) {
        @Override
        public Optional<LabelProjection> toLabel(SpatialReference srs) {
            return Optional.empty();
        }
    },
    EQUIDISTANT_CONIC("Equidistant_Conic",
            "+proj=eqdc +lat_1={standard_parallel_1} +lat_2={standard_parallel_2} +lat_0={latitude_of_center} "
                    + "+lon_0={longitude_of_center}",
            STANDARD_PARALLEL_1, STANDARD_PARALLEL_2, LATITUDE_OF_CENTER, LONGITUDE_OF_CENTER) {
        @Override
        public Optional<LabelProjection> toLabel(SpatialReference srs) {
            return Optional.empty();
        }
    },
    GNOMONIC("Gnomonic",
            "+proj=gnom +lat_0={latitude_of_origin} +lon_0={central_meridian}",
            LATITUDE_OF_ORIGIN, CENTRAL_MERIDIAN) {
        @Override
        public Optional<LabelProjection> toLabel(SpatialReference srs) {
            return Optional.empty();
        }
    },
    LAMBERT_AZIMUTHAL_EQUAL_AREA("Lambert_Azimuthal_Equal_Area",
            "+proj=laea +lat_0={latitude_of_center} +lon_0={longitude_of_center}",
            LATITUDE_OF_CENTER, LONGITUDE_OF_CENTER) {
        @Override
        public Optional<LabelProjection> toLabel(SpatialReference srs) {
            return Optional.empty();
        }
    },
    MILLER_CYLINDRICAL("Miller_Cylindrical",
            "+proj=mill +lat_0={latitude_of_center} +lon_0={longitude_of_center}",
            LATITUDE_OF_CENTER, LONGITUDE_OF_CENTER) {
        @Override
        public Optional<LabelProjection> toLabel(SpatialReference srs) {
            return Optional.empty();
        }
    },
    ORTHOGRAPHIC("Orthographic",
            "+proj=ortho +lat_0={latitude_of_origin} +lon_0={central_meridian}",
            LATITUDE_OF_ORIGIN, CENTRAL_MERIDIAN) {
        @Override
        public Optional<LabelProjection> toLabel(SpatialReference srs) {
            return centerOnly("Orthographic", srs);
        }
    },
    ROBINSON("Robinson",
            "+proj=robin +lon_0={longitude_of_center}",
            LONGITUDE_OF_CENTER) {
        @Override
        public Optional<LabelProjection> toLabel(SpatialReference srs) {
            return Optional.empty();
        }
    },
    STEREOGRAPHIC("Stereographic",
            "+proj=stere +lat_0={latitude_of_origin} +lon_0={central_meridian} +k={scale_factor}",
            LATITUDE_OF_ORIGIN, CENTRAL_MERIDIAN, SCALE_FACTOR) {
        @Override
        public Optional<LabelProjection> toLabel(SpatialReference srs) {
            return Optional.empty();
        }
    },
    VAN_DER_GRINTEN("VanDerGrinten",
            "+proj=vandg +lon_0={central_meridian}",
            CENTRAL_MERIDIAN) {
        @Override
        public Optional<LabelProjection> toLabel(SpatialReference srs) {
            return Optional.empty();
        }
    },
    MERCATOR_1SP("Mercator_1SP",
            "+proj=merc +lon_0={central_meridian} +k={scale_factor}",
            LATITUDE_OF_ORIGIN, CENTRAL_MERIDIAN, SCALE_FACTOR) {
        @Override
        public Optional<LabelProjection> toLabel(SpatialReference srs) {
            return Optional.of(LabelProjection.newBuilder("Mercator")
                    .scale("scale_factor_at_projection_origin", srs.parameter(SCALE_FACTOR, 1.0))
                    .angle("longitude_of_central_meridian", srs.parameter(CENTRAL_MERIDIAN, 0.0))
                    .angle("latitude_of_projection_origin", srs.parameter(LATITUDE_OF_ORIGIN, 0.0))
                    .build());
        }
    },
    MERCATOR_2SP("Mercator_2SP",
            "+proj=merc +lat_ts={standard_parallel_1} +lon_0={central_meridian}",
            STANDARD_PARALLEL_1, LATITUDE_OF_ORIGIN, CENTRAL_MERIDIAN) {
        @Override
        public Optional<LabelProjection> toLabel(SpatialReference srs) {
            return Optional.of(LabelProjection.newBuilder("Mercator")
                    .angle("standard_parallel_1", srs.parameter(STANDARD_PARALLEL_1, 0.0))
                    .angle("longitude_of_central_meridian", srs.parameter(CENTRAL_MERIDIAN, 0.0))
                    .angle("latitude_of_projection_origin", srs.parameter(LATITUDE_OF_ORIGIN, 0.0))
                    .build());
        }
    };

    private static final Pattern PROJ4_PLACEHOLDER = Pattern.compile("\\{(\\w+)}");

    private final String wktName;
    private final String proj4Template;
    private final List<String> parameterNames;

    CanonicalProjection(String wktName, String proj4Template, String... parameterNames) {
        this.wktName = wktName;
        this.proj4Template = proj4Template;
        this.parameterNames = List.of(parameterNames);
    }

    public String wktName() {
        return wktName;
    }

    /**
     * Returns names of the parameters of this projection, in the order, expected by
     * {@link SpatialReference.Builder#setProjection(CanonicalProjection, double...)}.
     * False easting and northing are not included: they are common for all projections.
     *
     * @return parameter names.
     */
    public List<String> parameterNames() {
        return parameterNames;
    }

    /**
     * Converts this projection with the parameters from the given spatial reference into
     * PDS4 <code>Map_Projection</code> content.
     *
     * @param srs spatial reference with this projection.
     * @return PDS4 projection or empty result, if PDS4 has no representation for this projection.
     */
    public abstract Optional<LabelProjection> toLabel(SpatialReference srs);

    /**
     * Returns proj4 parameters of this projection, without ellipsoid, false origin and units.
     *
     * @param srs spatial reference with this projection.
     * @return proj4 definition of the projection.
     */
    public String proj4(SpatialReference srs) {
        Objects.requireNonNull(srs, "Null srs");
        final Matcher matcher = PROJ4_PLACEHOLDER.matcher(proj4Template);
        final StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            final String name = matcher.group(1);
            final double value = name.equals("pole") ?
                    (srs.parameter(LATITUDE_OF_ORIGIN, 90.0) >= 0.0 ? 90.0 : -90.0) :
                    srs.parameter(name, name.equals(SCALE_FACTOR) ? 1.0 : 0.0);
            matcher.appendReplacement(sb, Pds4Tools.formatDouble(value));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    public static Optional<CanonicalProjection> fromWktName(String wktName) {
        for (CanonicalProjection projection : values()) {
            if (projection.wktName.equalsIgnoreCase(wktName)) {
                return Optional.of(projection);
            }
        }
        return Optional.empty();
    }

    private static Optional<LabelProjection> centerOnly(String name, SpatialReference srs) {
        return Optional.of(LabelProjection.newBuilder(name)
                .angle("longitude_of_central_meridian", srs.parameter(CENTRAL_MERIDIAN, 0.0))
                .angle("latitude_of_projection_origin", srs.parameter(LATITUDE_OF_ORIGIN, 0.0))
                .build());
    }
}
