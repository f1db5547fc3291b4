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

import org.apache.sis.io.wkt.Convention;
import org.apache.sis.io.wkt.WKTFormat;
import org.apache.sis.measure.Units;
import org.apache.sis.metadata.iso.citation.Citations;
import org.apache.sis.referencing.CRS;
import org.apache.sis.referencing.IdentifiedObjects;
import org.apache.sis.referencing.factory.GeodeticObjectFactory;
import org.apache.sis.referencing.operation.DefaultCoordinateOperationFactory;
import org.apache.sis.referencing.operation.transform.DefaultMathTransformFactory;
import org.opengis.parameter.GeneralParameterValue;
import org.opengis.parameter.ParameterValue;
import org.opengis.parameter.ParameterValueGroup;
import org.opengis.referencing.IdentifiedObject;
import org.opengis.referencing.crs.CoordinateReferenceSystem;
import org.opengis.referencing.crs.GeographicCRS;
import org.opengis.referencing.crs.ProjectedCRS;
import org.opengis.referencing.cs.AxisDirection;
import org.opengis.referencing.cs.CartesianCS;
import org.opengis.referencing.cs.EllipsoidalCS;
import org.opengis.referencing.datum.Ellipsoid;
import org.opengis.referencing.datum.GeodeticDatum;
import org.opengis.referencing.datum.PrimeMeridian;
import org.opengis.referencing.operation.Conversion;
import org.opengis.referencing.operation.OperationMethod;
import org.opengis.util.FactoryException;
import org.opengis.util.GenericName;

import javax.measure.Unit;
import javax.measure.quantity.Length;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Conversion between {@link SpatialReference} and WKT1 text through Apache SIS referencing objects.
 */
final class WktConverter {
    private static final String SEMI_MAJOR = "semi_major";
    private static final String SEMI_MINOR = "semi_minor";

    private WktConverter() {
    }

    static String toWkt(SpatialReference srs) {
        if (srs.isEmpty()) {
            return "";
        }
        final CoordinateReferenceSystem crs;
        try {
            final GeodeticObjectFactory factory = new GeodeticObjectFactory();
            final GeographicCRS geographic = geographicCRS(factory, srs.geographicCS().orElse(GeographicCS.WGS84));
            crs = srs.isProjected() ? projectedCRS(factory, geographic, srs) : geographic;
        } catch (FactoryException e) {
            throw new IllegalStateException("Cannot export " + srs.projection().map(Enum::name).orElse("geographic")
                    + " spatial reference to WKT: " + e.getMessage(), e);
        }
        final WKTFormat format = new WKTFormat(Locale.US, null);
        format.setConvention(Convention.WKT1);
        format.setIndentation(WKTFormat.SINGLE_LINE);
        return format.format(crs);
    }

    static SpatialReference fromWkt(String wkt) {
        final CoordinateReferenceSystem crs;
        try {
            crs = CRS.fromWKT(wkt);
        } catch (FactoryException e) {
            throw new IllegalArgumentException("Invalid WKT: " + e.getMessage(), e);
        }
        final SpatialReference.Builder builder = SpatialReference.newBuilder();
        if (crs instanceof GeographicCRS geographic) {
            return builder.setGeographicCS(geographicCS(geographic)).build();
        }
        if (!(crs instanceof ProjectedCRS projected)) {
            throw new IllegalArgumentException("Unsupported WKT coordinate reference system "
                    + crs.getName().getCode() + ": neither projected nor geographic");
        }
        builder.setProjectedName(projected.getName().getCode());
        builder.setGeographicCS(geographicCS(projected.getBaseCRS()));
        final Conversion conversion = projected.getConversionFromBase();
        final OperationMethod method = conversion.getMethod();
        final CanonicalProjection projection = canonicalProjection(method).orElseThrow(
                () -> new IllegalArgumentException("Unsupported WKT projection " + method.getName().getCode()));
        final Unit<?> linearUnit = projected.getCoordinateSystem().getAxis(0).getUnit();
        builder.setLinearUnits(Units.toStandardUnit(linearUnit));
        builder.setProjection(projection, projection.parameterNames().stream()
                .mapToDouble(WktConverter::defaultValue).toArray());
        for (GeneralParameterValue value : conversion.getParameterValues().values()) {
            if (value instanceof ParameterValue<?> parameter && parameter.getValue() instanceof Number) {
                final String name = ogcName(parameter.getDescriptor()).toLowerCase(Locale.ROOT);
                if (!name.equals(SEMI_MAJOR) && !name.equals(SEMI_MINOR)) {
                    builder.setParameter(name, doubleValue(parameter, linearUnit));
                }
            }
        }
        return builder.build();
    }

    private static GeographicCRS geographicCRS(GeodeticObjectFactory factory, GeographicCS cs)
            throws FactoryException {
        final Ellipsoid ellipsoid = cs.isSphere() ?
                factory.createEllipsoid(name(cs.spheroidName()), cs.semiMajor(), cs.semiMajor(), Units.METRE) :
                factory.createFlattenedSphere(name(cs.spheroidName()), cs.semiMajor(), cs.inverseFlattening(),
                        Units.METRE);
        final PrimeMeridian primeMeridian = factory.createPrimeMeridian(
                name(cs.primeMeridianName()), cs.primeMeridian(), Units.DEGREE);
        final GeodeticDatum datum = factory.createGeodeticDatum(name(cs.datumName()), ellipsoid, primeMeridian);
        final EllipsoidalCS axes = factory.createEllipsoidalCS(name("Ellipsoidal"),
                factory.createCoordinateSystemAxis(name("Longitude"), "Lon", AxisDirection.EAST, Units.DEGREE),
                factory.createCoordinateSystemAxis(name("Latitude"), "Lat", AxisDirection.NORTH, Units.DEGREE));
        return factory.createGeographicCRS(name(cs.name()), datum, axes);
    }

    private static ProjectedCRS projectedCRS(
            GeodeticObjectFactory factory,
            GeographicCRS base,
            SpatialReference srs) throws FactoryException {
        final CanonicalProjection projection = srs.projection().orElseThrow();
        final Unit<Length> linearUnit = srs.linearUnits() == 1.0 ?
                Units.METRE : Units.METRE.multiply(srs.linearUnits());
        final DefaultMathTransformFactory transformFactory = new DefaultMathTransformFactory();
        final OperationMethod method = transformFactory.getOperationMethod(projection.wktName());
        final ParameterValueGroup values = transformFactory.getDefaultParameters(projection.wktName());
        for (Map.Entry<String, Double> entry : srs.parameters().entrySet()) {
            final String name = entry.getKey();
            final Unit<?> unit = name.equals(ProjectionParameter.SCALE_FACTOR) ? Units.UNITY :
                    isFalseOrigin(name) ? linearUnit : Units.DEGREE;
            values.parameter(name).setValue(entry.getValue(), unit);
        }
        final Conversion conversion = new DefaultCoordinateOperationFactory().createDefiningConversion(
                name(projection.wktName()), method, values);
        final CartesianCS axes = factory.createCartesianCS(name("Cartesian"),
                factory.createCoordinateSystemAxis(name("Easting"), "E", AxisDirection.EAST, linearUnit),
                factory.createCoordinateSystemAxis(name("Northing"), "N", AxisDirection.NORTH, linearUnit));
        final String projectedName = srs.projectedName() == null ? "unnamed" : srs.projectedName();
        return factory.createProjectedCRS(name(projectedName), base, conversion, axes);
    }

    private static GeographicCS geographicCS(GeographicCRS crs) {
        final GeodeticDatum datum = crs.getDatum();
        final Ellipsoid ellipsoid = datum.getEllipsoid();
        final PrimeMeridian primeMeridian = datum.getPrimeMeridian();
        final double semiMajor = ellipsoid.getAxisUnit().getConverterTo(Units.METRE)
                .convert(ellipsoid.getSemiMajorAxis());
        final double primeMeridianLongitude = primeMeridian.getAngularUnit().getConverterTo(Units.DEGREE)
                .convert(primeMeridian.getGreenwichLongitude());
        return new GeographicCS(
                crs.getName().getCode(),
                datum.getName().getCode(),
                ellipsoid.getName().getCode(),
                semiMajor,
                ellipsoid.isSphere() ? 0.0 : ellipsoid.getInverseFlattening(),
                primeMeridian.getName().getCode(),
                primeMeridianLongitude);
    }

    private static Optional<CanonicalProjection> canonicalProjection(OperationMethod method) {
        final List<String> names = new ArrayList<>();
        names.add(ogcName(method));
        names.add(method.getName().getCode());
        for (GenericName alias : method.getAlias()) {
            names.add(alias.tip().toString());
        }
        for (String name : names) {
            final Optional<CanonicalProjection> result = CanonicalProjection.fromWktName(name);
            if (result.isPresent()) {
                return result;
            }
        }
        return Optional.empty();
    }

    private static double doubleValue(ParameterValue<?> parameter, Unit<?> linearUnit) {
        final Unit<?> unit = parameter.getUnit();
        if (unit == null) {
            return parameter.doubleValue();
        }
        if (unit.isCompatible(Units.DEGREE)) {
            return parameter.doubleValue(Units.DEGREE);
        }
        if (unit.isCompatible(Units.METRE)) {
            return parameter.doubleValue(linearUnit);
        }
        return parameter.doubleValue();
    }

    private static double defaultValue(String name) {
        return name.equals(ProjectionParameter.SCALE_FACTOR) ? 1.0 : 0.0;
    }

    private static boolean isFalseOrigin(String name) {
        return name.equals(ProjectionParameter.FALSE_EASTING) || name.equals(ProjectionParameter.FALSE_NORTHING);
    }

    // WKT1 names of operations and parameters are registered under the OGC authority
    private static String ogcName(IdentifiedObject object) {
        final String result = IdentifiedObjects.getName(object, Citations.OGC);
        return result != null ? result : object.getName().getCode();
    }

    private static Map<String, ?> name(String name) {
        return Map.of(IdentifiedObject.NAME_KEY, name);
    }
}
