package net.spotter.core.model;

import java.util.ArrayList;
import java.util.List;

/** 탐색 영역(직사각형). 잘못된 경계는 기동 시점의 설정 오류 */
public record Region(double south, double west, double north, double east) {

    public Region {
        if (south < -90 || north > 90 || west < -180 || east > 180) {
            throw new IllegalArgumentException("region bounds out of range: " + south + "," + west + " / " + north + "," + east);
        }
        if (south >= north || west >= east) {
            throw new IllegalArgumentException("region bounds must satisfy south<north and west<east: "
                    + south + "," + west + " / " + north + "," + east);
        }
    }

    /** 임의의 두 꼭짓점에서 생성 (MAP_START/MAP_END 방식) */
    public static Region of(GeoPoint a, GeoPoint b) {
        return new Region(Math.min(a.lat(), b.lat()), Math.min(a.lon(), b.lon()),
                Math.max(a.lat(), b.lat()), Math.max(a.lon(), b.lon()));
    }

    public boolean contains(GeoPoint p) {
        return p.lat() >= south && p.lat() <= north && p.lon() >= west && p.lon() <= east;
    }

    public GeoPoint center() {
        return new GeoPoint((south + north) / 2, (west + east) / 2);
    }

    /** 워커 번호에 해당하는 격자 칸의 중심 (rows x cols) */
    public GeoPoint startPosition(int workerNo, int rows, int cols) {
        if (rows <= 0 || cols <= 0) throw new IllegalArgumentException("grid must be positive: " + rows + "x" + cols);
        int row = (workerNo / cols) % rows;
        int col = workerNo % cols;
        double partLat = (north - south) / rows;
        double partLon = (east - west) / cols;
        return new GeoPoint(south + partLat * row + partLat / 2, west + partLon * col + partLon / 2);
    }

    /** 탐색 셀 크기(미터)에 대한 위도/경도 간격 */
    public double[] cellSteps(double cellMeters) {
        if (cellMeters <= 0) throw new IllegalArgumentException("cellMeters must be positive: " + cellMeters);
        GeoPoint c = center();
        double latStep = cellMeters / c.distanceTo(c.offset(1, 0));
        double lonStep = cellMeters / Math.max(1e-9, c.distanceTo(new GeoPoint(c.lat(), c.lon() > 179 ? c.lon() - 1 : c.lon() + 1)));
        return new double[]{latStep, lonStep};
    }

    /** 셀 중심 목록 (행 우선) */
    public List<GeoPoint> cells(double cellMeters) {
        double[] steps = cellSteps(cellMeters);
        List<GeoPoint> out = new ArrayList<>();
        for (double lat = south + steps[0] / 2; lat <= north; lat += steps[0]) {
            for (double lon = west + steps[1] / 2; lon <= east; lon += steps[1]) {
                out.add(new GeoPoint(lat, lon));
            }
        }
        if (out.isEmpty()) out.add(center());
        return out;
    }
}
