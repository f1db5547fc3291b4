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

import net.algart.matrices.pds4.Pds4Exception;
import net.algart.matrices.pds4.Pds4Warnings;
import net.algart.matrices.pds4.label.LabelTree;
import org.junit.jupiter.api.Test;

import static net.algart.matrices.pds4.geo.ProjectionParameter.*;
import static org.junit.jupiter.api.Assertions.*;

final class Pds4GeoreferencingReaderTest {
    private static final String MARS_MODEL = """
            <Geodetic_Model>
              <latitude_type>%s</latitude_type>
              <spheroid_name>MARS</spheroid_name>
              <semi_major_radius unit="m">3396190</semi_major_radius>
              <semi_minor_radius unit="m">3396190</semi_minor_radius>
              <polar_radius unit="km">3376.2</polar_radius>
              <longitude_direction>Positive East</longitude_direction>
            </Geodetic_Model>""";

    private static final String COORDINATES = """
            <Planar_Coordinate_Information>
              <planar_coordinate_encoding_method>Coordinate Pair</planar_coordinate_encoding_method>
              <Coordinate_Representation>
                <pixel_resolution_x unit="m/pixel">100</pixel_resolution_x>
                <pixel_resolution_y unit="km/pixel">0.2</pixel_resolution_y>
              </Coordinate_Representation>
            </Planar_Coordinate_Information>
            <Geo_Transformation>
              <upperleft_corner_x unit="m">-1000</upperleft_corner_x>
              <upperleft_corner_y unit="km">3</upperleft_corner_y>
            </Geo_Transformation>""";

    private final Pds4Warnings warnings = new Pds4Warnings();

    @Test
    void equirectangularUsesSphereAndPixelCenters() throws Pds4Exception {
        final Pds4Georeferencing result = read("""
                <Map_Projection>
                  <map_projection_name>Equirectangular</map_projection_name>
                  <Equirectangular>
                    <standard_parallel_1 unit="deg">10</standard_parallel_1>
                    <longitude_of_central_meridian unit="deg">180</longitude_of_central_meridian>
                    <latitude_of_projection_origin unit="deg">0</latitude_of_projection_origin>
                  </Equirectangular>
                </Map_Projection>""" + COORDINATES, MARS_MODEL.formatted("planetocentric"));
        assertTrue(warnings.isEmpty(), warnings.toString());
        final SpatialReference srs = result.spatialReference().orElseThrow();
        assertEquals(CanonicalProjection.EQUIRECTANGULAR, srs.projection().orElseThrow());
        assertEquals(10.0, srs.parameter(STANDARD_PARALLEL_1, Double.NaN));
        assertEquals(180.0, srs.parameter(CENTRAL_MERIDIAN, Double.NaN));
        assertEquals("Equirectangular Mars", srs.projectedName());
        final GeographicCS cs = srs.geographicCS().orElseThrow();
        assertEquals("GCS_Mars", cs.name());
        assertEquals("D_MARS", cs.datumName());
        assertTrue(cs.isSphere());
        assertEquals(3396190.0, cs.semiMajor(), 1e-6);

        final GeoTransform transform = result.geoTransform().orElseThrow();
        assertEquals(-1050.0, transform.originX(), 1e-9);
        assertEquals(100.0, transform.pixelWidth(), 1e-9);
        assertEquals(3100.0, transform.originY(), 1e-9);
        assertEquals(-200.0, transform.pixelHeight(), 1e-9);
        assertTrue(transform.isNorthUp());
    }

    @Test
    void polarStereographicEllipsoidDependsOnLatitudeType() throws Pds4Exception {
        final String projection = """
                <Map_Projection>
                  <map_projection_name>Polar Stereographic</map_projection_name>
                  <Polar_Stereographic>
                    <straight_vertical_longitude_from_pole unit="deg">45</straight_vertical_longitude_from_pole>
                    <scale_factor_at_projection_origin>0.99</scale_factor_at_projection_origin>
                    <latitude_of_projection_origin unit="deg">-90</latitude_of_projection_origin>
                  </Polar_Stereographic>
                </Map_Projection>""";
        final SpatialReference graphic = read(projection, MARS_MODEL.formatted("planetographic"))
                .spatialReference().orElseThrow();
        assertEquals(CanonicalProjection.POLAR_STEREOGRAPHIC, graphic.projection().orElseThrow());
        assertEquals(45.0, graphic.parameter(CENTRAL_MERIDIAN, Double.NaN));
        assertEquals(-90.0, graphic.parameter(LATITUDE_OF_ORIGIN, Double.NaN));
        assertEquals(0.99, graphic.parameter(SCALE_FACTOR, Double.NaN));
        assertFalse(graphic.geographicCS().orElseThrow().isSphere());
        assertEquals(3376200.0, graphic.semiMinor(), 1e-3);

        final SpatialReference centric = read(projection, MARS_MODEL.formatted("planetocentric"))
                .spatialReference().orElseThrow();
        final GeographicCS cs = centric.geographicCS().orElseThrow();
        assertTrue(cs.isSphere());
        assertEquals(3376200.0, cs.semiMajor(), 1e-6);
        assertEquals("MARS_polarRadius", cs.spheroidName());
    }

    @Test
    void lambertConformalConicFormulations() throws Pds4Exception {
        final SpatialReference twoParallels = read("""
                <Map_Projection>
                  <map_projection_name>Lambert Conformal Conic</map_projection_name>
                  <Lambert_Conformal_Conic>
                    <standard_parallel_1 unit="deg">20</standard_parallel_1>
                    <standard_parallel_2 unit="deg">40</standard_parallel_2>
                    <longitude_of_central_meridian unit="deg">10</longitude_of_central_meridian>
                    <latitude_of_projection_origin unit="deg">30</latitude_of_projection_origin>
                  </Lambert_Conformal_Conic>
                </Map_Projection>""", "").spatialReference().orElseThrow();
        assertEquals(CanonicalProjection.LAMBERT_CONFORMAL_CONIC_2SP, twoParallels.projection().orElseThrow());
        assertEquals(40.0, twoParallels.parameter(STANDARD_PARALLEL_2, Double.NaN));
        assertTrue(warnings.isEmpty(), warnings.toString());

        final SpatialReference scaled = read("""
                <Map_Projection>
                  <map_projection_name>Lambert Conformal Conic</map_projection_name>
                  <Lambert_Conformal_Conic>
                    <standard_parallel_1 unit="deg">20</standard_parallel_1>
                    <scale_factor_at_projection_origin>0.9</scale_factor_at_projection_origin>
                    <longitude_of_central_meridian unit="deg">10</longitude_of_central_meridian>
                    <latitude_of_projection_origin unit="deg">30</latitude_of_projection_origin>
                  </Lambert_Conformal_Conic>
                </Map_Projection>""", "").spatialReference().orElseThrow();
        assertEquals(CanonicalProjection.LAMBERT_CONFORMAL_CONIC_1SP, scaled.projection().orElseThrow());
        assertEquals(0.9, scaled.parameter(SCALE_FACTOR, Double.NaN));
        assertEquals(30.0, scaled.parameter(LATITUDE_OF_ORIGIN, Double.NaN));
        assertTrue(warnings.contains("Ignoring standard_parallel_1"), warnings.toString());
    }

    @Test
    void obliqueMercatorUsesFirstTwoPoints() throws Pds4Exception {
        final SpatialReference srs = read("""
                <Map_Projection>
                  <map_projection_name>Oblique Mercator</map_projection_name>
                  <Oblique_Mercator>
                    <Oblique_Line_Point>
                      <Oblique_Line_Point_Group>
                        <oblique_line_latitude unit="deg">1</oblique_line_latitude>
                        <oblique_line_longitude unit="deg">2</oblique_line_longitude>
                      </Oblique_Line_Point_Group>
                      <Oblique_Line_Point_Group>
                        <oblique_line_latitude unit="deg">3</oblique_line_latitude>
                        <oblique_line_longitude unit="deg">4</oblique_line_longitude>
                      </Oblique_Line_Point_Group>
                      <Oblique_Line_Point_Group>
                        <oblique_line_latitude unit="deg">5</oblique_line_latitude>
                        <oblique_line_longitude unit="deg">6</oblique_line_longitude>
                      </Oblique_Line_Point_Group>
                    </Oblique_Line_Point>
                    <scale_factor_at_projection_origin>0.5</scale_factor_at_projection_origin>
                    <latitude_of_projection_origin unit="deg">7</latitude_of_projection_origin>
                  </Oblique_Mercator>
                </Map_Projection>""", "").spatialReference().orElseThrow();
        assertEquals(CanonicalProjection.HOTINE_OBLIQUE_MERCATOR_TWO_POINT_NATURAL_ORIGIN,
                srs.projection().orElseThrow());
        assertEquals(7.0, srs.parameter(LATITUDE_OF_CENTER, Double.NaN));
        assertEquals(1.0, srs.parameter(LATITUDE_OF_POINT_1, Double.NaN));
        assertEquals(2.0, srs.parameter(LONGITUDE_OF_POINT_1, Double.NaN));
        assertEquals(3.0, srs.parameter(LATITUDE_OF_POINT_2, Double.NaN));
        assertEquals(4.0, srs.parameter(LONGITUDE_OF_POINT_2, Double.NaN));
        assertEquals(0.5, srs.parameter(SCALE_FACTOR, Double.NaN));
    }

    @Test
    void obliqueMercatorWithAzimuth() throws Pds4Exception {
        final SpatialReference srs = read("""
                <Map_Projection>
                  <map_projection_name>Oblique Mercator</map_projection_name>
                  <Oblique_Mercator>
                    <Oblique_Line_Azimuth>
                      <azimuthal_angle unit="deg">30</azimuthal_angle>
                      <azimuth_measure_point_longitude unit="deg">100</azimuth_measure_point_longitude>
                    </Oblique_Line_Azimuth>
                    <latitude_of_projection_origin unit="deg">5</latitude_of_projection_origin>
                  </Oblique_Mercator>
                </Map_Projection>""", "").spatialReference().orElseThrow();
        assertEquals(CanonicalProjection.HOTINE_OBLIQUE_MERCATOR_AZIMUTH_CENTER, srs.projection().orElseThrow());
        assertEquals(30.0, srs.parameter(AZIMUTH, Double.NaN));
        assertEquals(100.0, srs.parameter(LONGITUDE_OF_CENTER, Double.NaN));
        assertEquals(5.0, srs.parameter(LATITUDE_OF_CENTER, Double.NaN));
        assertEquals(1.0, srs.parameter(SCALE_FACTOR, Double.NaN));
    }

    @Test
    void obliqueMercatorWithoutLineIsNotSupported() throws Pds4Exception {
        read("""
                <Map_Projection>
                  <map_projection_name>Oblique Mercator</map_projection_name>
                  <Oblique_Mercator>
                    <latitude_of_projection_origin unit="deg">5</latitude_of_projection_origin>
                  </Oblique_Mercator>
                </Map_Projection>""", "");
        assertTrue(warnings.contains("map_projection_name = Oblique Mercator not supported"), warnings.toString());
    }

    @Test
    void mercatorFormulations() throws Pds4Exception {
        final SpatialReference twoParallels = read("""
                <Map_Projection>
                  <map_projection_name>Mercator</map_projection_name>
                  <Mercator>
                    <standard_parallel_1 unit="deg">15</standard_parallel_1>
                    <longitude_of_central_meridian unit="deg">0</longitude_of_central_meridian>
                  </Mercator>
                </Map_Projection>""", "").spatialReference().orElseThrow();
        assertEquals(CanonicalProjection.MERCATOR_2SP, twoParallels.projection().orElseThrow());
        assertEquals(15.0, twoParallels.parameter(STANDARD_PARALLEL_1, Double.NaN));

        final SpatialReference scaled = read("""
                <Map_Projection>
                  <map_projection_name>Mercator</map_projection_name>
                  <Mercator>
                    <scale_factor_at_projection_origin>0.98</scale_factor_at_projection_origin>
                  </Mercator>
                </Map_Projection>""", "").spatialReference().orElseThrow();
        assertEquals(CanonicalProjection.MERCATOR_1SP, scaled.projection().orElseThrow());
        assertEquals(0.98, scaled.parameter(SCALE_FACTOR, Double.NaN));
    }

    @Test
    void misspelledOrthographicIsAccepted() throws Pds4Exception {
        final SpatialReference srs = read("""
                <Map_Projection>
                  <map_projection_name>Orothographic</map_projection_name>
                  <Orothographic>
                    <longitude_of_central_meridian unit="deg">20</longitude_of_central_meridian>
                    <latitude_of_projection_origin unit="deg">-10</latitude_of_projection_origin>
                  </Orothographic>
                </Map_Projection>""", "").spatialReference().orElseThrow();
        assertEquals(CanonicalProjection.ORTHOGRAPHIC, srs.projection().orElseThrow());
        assertEquals(20.0, srs.parameter(CENTRAL_MERIDIAN, Double.NaN));
        assertEquals(-10.0, srs.parameter(LATITUDE_OF_ORIGIN, Double.NaN));
    }

    @Test
    void utmCornerIsNotShiftedByFalseOrigin() throws Pds4Exception {
        final Pds4Georeferencing south = read("""
                <Grid_Coordinate_System>
                  <grid_coordinate_system_name>Universal Transverse Mercator</grid_coordinate_system_name>
                  <Universal_Transverse_Mercator>
                    <utm_zone_number>-33</utm_zone_number>
                  </Universal_Transverse_Mercator>
                </Grid_Coordinate_System>""" + COORDINATES, "");
        final SpatialReference srs = south.spatialReference().orElseThrow();
        assertEquals(CanonicalProjection.TRANSVERSE_MERCATOR, srs.projection().orElseThrow());
        assertEquals(15.0, srs.parameter(CENTRAL_MERIDIAN, Double.NaN));
        assertEquals(10000000.0, srs.falseNorthing());
        final GeoTransform southTransform = south.geoTransform().orElseThrow();
        assertEquals(-1050.0, southTransform.originX(), 1e-6);
        assertEquals(3100.0, southTransform.originY(), 1e-6);

        final Pds4Georeferencing north = read("""
                <Grid_Coordinate_System>
                  <grid_coordinate_system_name>Universal Transverse Mercator</grid_coordinate_system_name>
                  <Universal_Transverse_Mercator>
                    <utm_zone_number>31</utm_zone_number>
                  </Universal_Transverse_Mercator>
                </Grid_Coordinate_System>
                <Planar_Coordinate_Information>
                  <planar_coordinate_encoding_method>Coordinate Pair</planar_coordinate_encoding_method>
                  <Coordinate_Representation>
                    <pixel_resolution_x unit="m/pixel">30</pixel_resolution_x>
                    <pixel_resolution_y unit="m/pixel">30</pixel_resolution_y>
                  </Coordinate_Representation>
                </Planar_Coordinate_Information>
                <Geo_Transformation>
                  <upperleft_corner_x unit="m">440015</upperleft_corner_x>
                  <upperleft_corner_y unit="m">5000015</upperleft_corner_y>
                </Geo_Transformation>""", "");
        assertEquals(500000.0, north.spatialReference().orElseThrow().falseEasting());
        final GeoTransform northTransform = north.geoTransform().orElseThrow();
        assertEquals(440000.0, northTransform.originX(), 1e-6);
        assertEquals(5000030.0, northTransform.originY(), 1e-6);
        assertEquals(30.0, northTransform.pixelWidth(), 1e-9);
    }

    @Test
    void invalidUtmZoneIsIgnored() throws Pds4Exception {
        final Pds4Georeferencing result = read("""
                <Grid_Coordinate_System>
                  <grid_coordinate_system_name>Universal Transverse Mercator</grid_coordinate_system_name>
                  <Universal_Transverse_Mercator>
                    <utm_zone_number>0</utm_zone_number>
                  </Universal_Transverse_Mercator>
                </Grid_Coordinate_System>""", "");
        assertTrue(warnings.contains("Invalid utm_zone_number 0"), warnings.toString());
        assertTrue(result.spatialReference().isEmpty());
    }

    @Test
    void universalPolarStereographic() throws Pds4Exception {
        final SpatialReference srs = read("""
                <Grid_Coordinate_System>
                  <grid_coordinate_system_name>Universal Polar Stereographic</grid_coordinate_system_name>
                  <Universal_Polar_Stereographic>
                    <Polar_Stereographic>
                      <straight_vertical_longitude_from_pole unit="deg">0</straight_vertical_longitude_from_pole>
                      <scale_factor_at_projection_origin>0.994</scale_factor_at_projection_origin>
                      <latitude_of_projection_origin unit="deg">90</latitude_of_projection_origin>
                    </Polar_Stereographic>
                  </Universal_Polar_Stereographic>
                </Grid_Coordinate_System>""", "").spatialReference().orElseThrow();
        assertEquals(CanonicalProjection.POLAR_STEREOGRAPHIC, srs.projection().orElseThrow());
        assertEquals(0.994, srs.parameter(SCALE_FACTOR, Double.NaN));
        assertEquals(90.0, srs.parameter(LATITUDE_OF_ORIGIN, Double.NaN));
    }

    @Test
    void unsupportedProjectionKeepsGeodeticModel() throws Pds4Exception {
        final Pds4Georeferencing result = read("""
                <Map_Projection>
                  <map_projection_name>Bonne</map_projection_name>
                </Map_Projection>""", MARS_MODEL.formatted("planetocentric"));
        assertTrue(warnings.contains("map_projection_name = Bonne not supported"), warnings.toString());
        final SpatialReference srs = result.spatialReference().orElseThrow();
        assertTrue(srs.isGeographic());
        assertEquals("GCS_Mars", srs.geographicCS().orElseThrow().name());
    }

    @Test
    void missingProjectionIsReported() throws Pds4Exception {
        final Pds4Georeferencing result = read(COORDINATES, "");
        assertTrue(warnings.contains("Planar.Map_Projection not found"), warnings.toString());
        assertTrue(result.spatialReference().isEmpty());
        assertTrue(result.geoTransform().isPresent());
    }

    @Test
    void differentSemiMinorRadiusIsIgnored() throws Pds4Exception {
        read("<Map_Projection><map_projection_name>Sinusoidal</map_projection_name></Map_Projection>", """
                <Geodetic_Model>
                  <semi_major_radius unit="m">3396190</semi_major_radius>
                  <semi_minor_radius unit="m">3390000</semi_minor_radius>
                  <polar_radius unit="m">3376200</polar_radius>
                </Geodetic_Model>""");
        assertTrue(warnings.contains("will be ignored"), warnings.toString());
    }

    @Test
    void unsupportedEncodingGivesNoTransform() throws Pds4Exception {
        final Pds4Georeferencing result = read(COORDINATES.replace("Coordinate Pair", "Distance and Bearing"), "");
        assertTrue(warnings.contains("planar_coordinate_encoding_method = Distance and Bearing not supported"),
                warnings.toString());
        assertTrue(result.geoTransform().isEmpty());
    }

    @Test
    void labelWithoutCartographyHasNoGeoreferencing() throws Pds4Exception {
        final LabelTree tree = LabelTree.parse(
                "<Product_Observational><Observation_Area/></Product_Observational>");
        final Pds4Georeferencing result = new Pds4GeoreferencingReader(warnings).read(tree, tree.rootElement());
        assertTrue(result.isEmpty());
        assertTrue(warnings.isEmpty());
    }

    private Pds4Georeferencing read(String planar, String geodeticModel) throws Pds4Exception {
        final LabelTree tree = LabelTree.parse("""
                <Product_Observational>
                  <Observation_Area>
                    <Target_Identification><name>Mars</name></Target_Identification>
                    <Discipline_Area>
                      <cart:Cartography xmlns:cart="http://pds.nasa.gov/pds4/cart/v1">
                        <cart:Spatial_Reference_Information>
                          <cart:Horizontal_Coordinate_System_Definition>
                            <cart:Planar>%s</cart:Planar>
                            %s
                          </cart:Horizontal_Coordinate_System_Definition>
                        </cart:Spatial_Reference_Information>
                      </cart:Cartography>
                    </Discipline_Area>
                  </Observation_Area>
                </Product_Observational>""".formatted(planar, geodeticModel));
        tree.stripNamespaces();
        return new Pds4GeoreferencingReader(warnings).read(tree, tree.rootElement());
    }
}
