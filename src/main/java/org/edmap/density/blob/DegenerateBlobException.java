package org.edmap.density.blob;

/**
 * blob 的总密度为 0，密度加权质心无定义。
 */
public class DegenerateBlobException extends RuntimeException {

    public DegenerateBlobException(String message) {
        super(message);
    }
}
