package com.jay.dossier.model;

/** A normalized statement value in base units (currency, shares, or currency per share). */
public record LineItem(double value, String unit) {
}
