package com.ssomonitor.detection.dto;

public record ClickPosition(double x, double y) {
}
