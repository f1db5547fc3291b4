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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class SpatialReferenceTest {
    private static final GeographicCS MARS = GeographicCS.sphere("GCS_Mars", "Mars_2000", "Mars", 3396190.0);

    @Test
    void projectedWktRoundTrip() {
        final SpatialReference srs = SpatialReference.newBuilder()
                .setProjectedName("Transverse Mercator Mars")
                .setProjection(CanonicalProjection.TRANSVERSE_MERCATOR, 10.0, 15.5, 0.9996)
                .setFalseOrigin(1000.0, -2000.0)
                .setGeographicCS(MARS)
                .build();
        final String wkt = srs.toWkt();
        assertTrue(wkt.startsWith("PROJCS[\"Transverse Mercator Mars\""), wkt);
        assertTrue(wkt.contains("GEOGCS[\"GCS_Mars\""), wkt);
        assertTrue(wkt.contains("PROJECTION[\"Transverse_Mercator\""), wkt);
        assertTrue(wkt.contains("PARAMETER[\"scale_factor\""), wkt);
        assertTrue(wkt.contains("0.9996"), wkt);
        assertFalse(wkt.contains("\n"), wkt);
        final SpatialReference parsed = SpatialReference.fromWkt(wkt);
        assertEquals(srs, parsed);
        assertEquals(1000.0, parsed.falseEasting());
        assertEquals(-2000.0, parsed.falseNorthing());
    }

    @Test
    void geographicWktRoundTrip() {
        final SpatialReference srs = SpatialReference.newBuilder().setGeographicCS(GeographicCS.WGS84).build();
        assertTrue(srs.isGeographic());
        final SpatialReference parsed = SpatialReference.fromWkt(srs.toWkt());
        assertEquals(srs, parsed);
        assertEquals(6356752.314245179, parsed.semiMinor(), 1e-6);
    }

    @Test
    void parsesForeignWkt() {
        final SpatialReference srs = SpatialReference.fromWkt("""
                PROJCS["Mars Sinusoidal",
                    GEOGCS["GCS_Mars",DATUM["D_Mars",SPHEROID["Mars",3396190,0]],PRIMEM["Reference_Meridian",0],
                        UNIT["degree",0.0174532925199433]],
                    PROJECTION["Sinusoidal"],
                    PARAMETER["Central_Meridian",180],
                    PARAMETER["False_Easting",0],
                    PARAMETER["False_Northing",0],
                    UNIT["metre",1]]""");
        assertEquals(CanonicalProjection.SINUSOIDAL, srs.projection().orElseThrow());
        assertEquals(180.0, srs.parameter(ProjectionParameter.CENTRAL_MERIDIAN, 0.0));
        assertTrue(srs.datumName().orElseThrow().endsWith("Mars"), srs.datumName().orElseThrow());
        assertTrue(srs.geographicCS().orElseThrow().isSphere());
        assertEquals(1.0, srs.linearUnits());
    }

    @Test
    void invalidWktIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> SpatialReference.fromWkt("PROJCS[\"x\""));
        assertThrows(IllegalArgumentException.class, () -> SpatialReference.fromWkt(
                "PROJCS[\"x\",PROJECTION[\"Unknown_Projection\"]]"));
        assertTrue(SpatialReference.fromWkt("  ").isEmpty());
        assertEquals("", SpatialReference.newBuilder().build().toWkt());
    }

    @Test
    void describesItselfWithProj4() {
        final SpatialReference srs = SpatialReference.newBuilder()
                .setProjectedName("Mars Robinson")
                .setProjection(CanonicalProjection.ROBINSON, 0.0)
                .setGeographicCS(MARS)
                .build();
        assertEquals("Mars Robinson (+proj=robin +lon_0=0 +x_0=0 +y_0=0 +a=3396190 +b=3396190 +units=m +no_defs)",
                srs.toString());
        assertEquals("empty spatial reference", SpatialReference.newBuilder().build().toString());
    }

    @Test
    void utmZones() {
        final SpatialReference north = SpatialReference.newBuilder().setUTM(33, true).build();
        assertEquals(15.0, north.parameter(ProjectionParameter.CENTRAL_MERIDIAN, Double.NaN));
        assertEquals(0.9996, north.parameter(ProjectionParameter.SCALE_FACTOR, Double.NaN));
        assertEquals(500000.0, north.falseEasting());
        assertEquals(0.0, north.falseNorthing());
        assertEquals("UTM Zone 33, Northern Hemisphere", north.projectedName());
        final SpatialReference south = SpatialReference.newBuilder().setUTM(1, false).build();
        assertEquals(-177.0, south.parameter(ProjectionParameter.CENTRAL_MERIDIAN, Double.NaN));
        assertEquals(10000000.0, south.falseNorthing());
        assertThrows(IllegalArgumentException.class, () -> SpatialReference.newBuilder().setUTM(61, true));
    }

    @Test
    void proj4Definition() {
        final SpatialReference srs = SpatialReference.newBuilder()
                .setProjection(CanonicalProjection.POLAR_STEREOGRAPHIC, -90.0, 0.0, 1.0)
                .setGeographicCS(MARS)
                .build();
        assertEquals("+proj=stere +lat_0=-90 +lat_ts=-90 +lon_0=0 +k=1 +x_0=0 +y_0=0 "
                + "+a=3396190 +b=3396190 +units=m +no_defs", srs.toProj4());
        assertEquals("+proj=longlat +a=3396190 +b=3396190 +no_defs", srs.geographic().orElseThrow().toProj4());
    }

    @Test
    void parameterCountIsChecked() {
        assertThrows(IllegalArgumentException.class, () -> SpatialReference.newBuilder()
                .setProjection(CanonicalProjection.SINUSOIDAL, 1.0, 2.0));
    }
}
