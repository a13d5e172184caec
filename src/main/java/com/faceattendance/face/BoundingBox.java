package com.faceattendance.face;

public record BoundingBox(double x, double y, double width, double height) {
}
