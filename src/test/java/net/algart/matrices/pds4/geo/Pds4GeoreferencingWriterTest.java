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

final class Pds4GeoreferencingWriterTest {
    private static final GeographicCS MARS = GeographicCS.sphere("GCS_Mars", "D_Mars", "Mars", 3396190.0);

    private final Pds4Warnings warnings = new Pds4Warnings();

    @Test
    void transverseMercatorRoundTrip() throws Pds4Exception {
        final SpatialReference srs = SpatialReference.newBuilder()
                .setProjection(CanonicalProjection.TRANSVERSE_MERCATOR, 0.0, 15.0, 0.9996)
                .setGeographicCS(MARS)
                .build();
        final GeoTransform transform = GeoTransform.northUp(-5000.0, 8000.0, 250.0, 250.0);
        final LabelTree tree = write(new Pds4GeoreferencingWriter(warnings), srs, transform, 100, 80);
        final int cartography = cartography(tree);
        assertEquals("Transverse Mercator", tree.value(cartography, "Spatial_Reference_Information."
                + "Horizontal_Coordinate_System_Definition.Planar.Map_Projection.map_projection_name", null));

        final Pds4Georeferencing result = new Pds4GeoreferencingReader(warnings).read(tree, tree.rootElement());
        assertTrue(warnings.isEmpty(), warnings.toString());
        final SpatialReference read = result.spatialReference().orElseThrow();
        assertEquals(CanonicalProjection.TRANSVERSE_MERCATOR, read.projection().orElseThrow());
        assertEquals(15.0, read.parameter(CENTRAL_MERIDIAN, Double.NaN));
        assertEquals(0.9996, read.parameter(SCALE_FACTOR, Double.NaN));
        assertEquals(3396190.0, read.semiMajor());
        assertEquals("Transverse Mercator Mars", read.projectedName());
        final GeoTransform readTransform = result.geoTransform().orElseThrow();
        assertArrayEquals(transform.toArray(), readTransform.toArray(), 1e-9);

        final double west = number(tree, cartography, "west_bounding_coordinate");
        final double east = number(tree, cartography, "east_bounding_coordinate");
        final double south = number(tree, cartography, "south_bounding_coordinate");
        final double north = number(tree, cartography, "north_bounding_coordinate");
        assertTrue(west < east && south < north);
        assertEquals(15.0, (west + east) / 2, 1.0);
    }

    @Test
    void sinusoidalRoundTrip() throws Pds4Exception {
        final SpatialReference srs = SpatialReference.newBuilder()
                .setProjection(CanonicalProjection.SINUSOIDAL, 180.0)
                .setGeographicCS(MARS)
                .build();
        final GeoTransform transform = GeoTransform.northUp(-1024.0, 512.0, 16.0, 8.0);
        final LabelTree tree = write(new Pds4GeoreferencingWriter(warnings), srs, transform, 10, 10);
        final Pds4Georeferencing result = new Pds4GeoreferencingReader(warnings).read(tree, tree.rootElement());
        final SpatialReference read = result.spatialReference().orElseThrow();
        assertEquals(CanonicalProjection.SINUSOIDAL, read.projection().orElseThrow());
        assertEquals(180.0, read.parameter(CENTRAL_MERIDIAN, Double.NaN));
        assertArrayEquals(transform.toArray(), result.geoTransform().orElseThrow().toArray(), 1e-9);
    }

    @Test
    void polarStereographicKeepsEllipsoid() throws Pds4Exception {
        final GeographicCS ellipsoid = new GeographicCS("GCS_Mars", "D_Mars", "Mars",
                3396190.0, 3396190.0 / 19990.0, GeographicCS.REFERENCE_MERIDIAN, 0.0);
        final SpatialReference srs = SpatialReference.newBuilder()
                .setProjection(CanonicalProjection.POLAR_STEREOGRAPHIC, 90.0, -45.0, 1.0)
                .setGeographicCS(ellipsoid)
                .build();
        final LabelTree tree = write(new Pds4GeoreferencingWriter(warnings)
                        .setLatitudeType("PLANETOGRAPHIC"),
                srs, GeoTransform.northUp(-100000.0, 100000.0, 1000.0, 1000.0), 200, 200);
        final int model = tree.find(cartography(tree),
                "Spatial_Reference_Information.Horizontal_Coordinate_System_Definition.Geodetic_Model");
        assertEquals("planetographic", tree.value(model, "latitude_type", null));
        assertEquals("Mars", tree.value(model, "spheroid_name", null));
        assertEquals(3396190.0, Double.parseDouble(tree.value(model, "semi_minor_radius", null)));
        assertEquals(3376200.0, Double.parseDouble(tree.value(model, "polar_radius", null)), 1e-6);

        final SpatialReference read = new Pds4GeoreferencingReader(warnings).read(tree, tree.rootElement())
                .spatialReference().orElseThrow();
        assertEquals(CanonicalProjection.POLAR_STEREOGRAPHIC, read.projection().orElseThrow());
        assertEquals(90.0, read.parameter(LATITUDE_OF_ORIGIN, Double.NaN));
        assertEquals(-45.0, read.parameter(CENTRAL_MERIDIAN, Double.NaN));
        assertFalse(read.geographicCS().orElseThrow().isSphere());
        assertEquals(3376200.0, read.semiMinor(), 1e-3);
    }

    @Test
    void geographicIsWrittenAsEquirectangular() throws Pds4Exception {
        final SpatialReference srs = SpatialReference.newBuilder().setGeographicCS(MARS).build();
        final LabelTree tree = write(new Pds4GeoreferencingWriter(warnings), srs,
                GeoTransform.northUp(-10.0, 5.0, 0.5, 0.25), 40, 40);
        final int cartography = cartography(tree);
        assertEquals(-9.75, number(tree, cartography, "west_bounding_coordinate"));
        assertEquals(9.75, number(tree, cartography, "east_bounding_coordinate"));
        assertEquals(4.875, number(tree, cartography, "north_bounding_coordinate"));
        assertEquals(-4.875, number(tree, cartography, "south_bounding_coordinate"));

        final int planar = tree.find(cartography,
                "Spatial_Reference_Information.Horizontal_Coordinate_System_Definition.Planar");
        assertEquals("Equirectangular", tree.value(planar, "Map_Projection.map_projection_name", null));
        assertEquals("0", tree.value(planar,
                "Map_Projection.Equirectangular.longitude_of_central_meridian", null));
        final double degreeToMeter = 3396190.0 * Math.PI / 180.0;
        assertEquals(0.5 * degreeToMeter, Double.parseDouble(tree.value(planar,
                "Planar_Coordinate_Information.Coordinate_Representation.pixel_resolution_x", null)), 1e-6);
        assertEquals("m/pixel", tree.value(planar,
                "Planar_Coordinate_Information.Coordinate_Representation.pixel_resolution_x.unit", null));
        assertEquals(2.0, Double.parseDouble(tree.value(planar,
                "Planar_Coordinate_Information.Coordinate_Representation.pixel_scale_x", null)));
        assertEquals(-9.75 * degreeToMeter, Double.parseDouble(tree.value(planar,
                "Geo_Transformation.upperleft_corner_x", null)), 1e-6);
    }

    @Test
    void falseOriginIsSubtracted() throws Pds4Exception {
        final SpatialReference srs = SpatialReference.newBuilder()
                .setProjection(CanonicalProjection.EQUIRECTANGULAR, 0.0, 0.0, 0.0)
                .setFalseOrigin(1000.0, 2000.0)
                .setGeographicCS(MARS)
                .build();
        final LabelTree tree = write(new Pds4GeoreferencingWriter(warnings), srs,
                GeoTransform.northUp(5000.0, 6000.0, 10.0, 10.0), 4, 4);
        final int transformation = tree.find(cartography(tree), "Spatial_Reference_Information."
                + "Horizontal_Coordinate_System_Definition.Planar.Geo_Transformation");
        assertEquals("4005", tree.value(transformation, "upperleft_corner_x", null));
        assertEquals("3995", tree.value(transformation, "upperleft_corner_y", null));
    }

    @Test
    void overridesFromOptions() throws Pds4Exception {
        final SpatialReference srs = SpatialReference.newBuilder().setGeographicCS(MARS).build();
        final LabelTree tree = write(new Pds4GeoreferencingWriter(warnings)
                        .setRadii(3396000.0, 3376000.0)
                        .setBoundingDegrees(-1.0, -2.0, 3.0, 4.0)
                        .setLongitudeDirection("positive west"),
                srs, GeoTransform.northUp(0.0, 0.0, 1.0, 1.0), 2, 2);
        final int cartography = cartography(tree);
        assertEquals(-1.0, number(tree, cartography, "west_bounding_coordinate"));
        assertEquals(-2.0, number(tree, cartography, "south_bounding_coordinate"));
        assertEquals(3.0, number(tree, cartography, "east_bounding_coordinate"));
        assertEquals(4.0, number(tree, cartography, "north_bounding_coordinate"));
        final int model = tree.find(cartography,
                "Spatial_Reference_Information.Horizontal_Coordinate_System_Definition.Geodetic_Model");
        assertEquals("3396000", tree.value(model, "semi_major_radius", null));
        assertEquals("3376000", tree.value(model, "polar_radius", null));
        assertEquals("Positive West", tree.value(model, "longitude_direction", null));
    }

    @Test
    void unsupportedProjectionWritesEmptyName() throws Pds4Exception {
        final SpatialReference srs = SpatialReference.newBuilder()
                .setProjection(CanonicalProjection.ALBERS_CONIC_EQUAL_AREA, 20.0, 40.0, 30.0, 10.0)
                .setGeographicCS(MARS)
                .build();
        final LabelTree tree = write(new Pds4GeoreferencingWriter(warnings), srs,
                GeoTransform.northUp(0.0, 0.0, 1.0, 1.0), 2, 2);
        assertTrue(warnings.contains("Projection Albers_Conic_Equal_Area not supported"), warnings.toString());
        final int mapProjection = tree.find(cartography(tree), "Spatial_Reference_Information."
                + "Horizontal_Coordinate_System_Definition.Planar.Map_Projection");
        assertEquals(1, tree.childElements(mapProjection).size());
        assertEquals("", tree.value(mapProjection, "map_projection_name", ""));
    }

    @Test
    void rotatedTransformIsRejected() {
        final SpatialReference srs = SpatialReference.newBuilder().setGeographicCS(MARS).build();
        assertThrows(IllegalArgumentException.class, () -> write(new Pds4GeoreferencingWriter(warnings), srs,
                new GeoTransform(0.0, 1.0, 0.1, 0.0, 0.0, -1.0), 2, 2));
    }

    @Test
    void elementsGetCartographyPrefix() {
        final LabelTree tree = newLabel();
        final int cartography = tree.find(tree.rootElement(), "Observation_Area.Discipline_Area.cart:Cartography");
        new Pds4GeoreferencingWriter(warnings).write(tree, cartography,
                SpatialReference.newBuilder().setGeographicCS(MARS).build(),
                GeoTransform.northUp(0.0, 0.0, 1.0, 1.0), 2, 2);
        assertNotEquals(LabelTree.NONE, tree.find(cartography,
                "cart:Spatial_Reference_Information.cart:Horizontal_Coordinate_System_Definition.cart:Planar"));
        assertNotEquals(LabelTree.NONE, tree.find(cartography, "cart:Spatial_Domain.cart:Bounding_Coordinates"));
    }

    private static LabelTree newLabel() {
        final LabelTree tree = LabelTree.newDocument();
        final int product = tree.addElement(tree.document(), "Product_Observational");
        final int observation = tree.addElement(product, "Observation_Area");
        tree.addElement(tree.addElement(observation, "Target_Identification"), "name", "Mars");
        tree.addElement(tree.addElement(observation, "Discipline_Area"), "cart:Cartography");
        return tree;
    }

    private static LabelTree write(
            Pds4GeoreferencingWriter writer,
            SpatialReference srs,
            GeoTransform transform,
            int sizeX,
            int sizeY) throws Pds4Exception {
        final LabelTree tree = newLabel();
        final int cartography = tree.find(tree.rootElement(), "Observation_Area.Discipline_Area.cart:Cartography");
        writer.write(tree, cartography, srs, transform, sizeX, sizeY);
        final LabelTree result = LabelTree.parse(tree.toXml());
        result.stripNamespaces();
        return result;
    }

    private static int cartography(LabelTree tree) {
        return tree.find(tree.rootElement(), Pds4GeoreferencingReader.CARTOGRAPHY_PATH);
    }

    private static double number(LabelTree tree, int cartography, String name) {
        return Double.parseDouble(tree.value(cartography, "Spatial_Domain.Bounding_Coordinates." + name, null));
    }
}
