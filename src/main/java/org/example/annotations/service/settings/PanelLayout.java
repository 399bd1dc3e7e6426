package org.example.annotations.service.settings;

public record PanelLayout(int panelWidth, int panelHeight, int readerWidth, int readerHeight) {
}
