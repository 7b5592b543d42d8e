package com.medlake.telegram.model;

/**
 * One finding returned by an object detector.
 *
 * @param label      predicted class name
 * @param confidence score between 0.0 and 1.0
 * @param box        location of the object in the image
 */
public record DetectedObject(String label, double confidence, BoundingBox box) {
}
