package io.brainrunr.memory;

/**
 * Pan/tilt angles of the camera when the memory was captured, in degrees.
 */
public record CameraPose(double pan, double tilt) {

    public CameraPose {
        if (!Double.isFinite(pan) || !Double.isFinite(tilt)) {
            throw new ValidationException("Camera angles must be finite");
        }
    }
}
