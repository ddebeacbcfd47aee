/**
 * Exception hierarchy shared by the engine and the service layer.
 *
 * <ul>
 * <li>{@link com.buildsentinel.core.error.ValidationException}: rejected
 * create/configure call</li>
 * <li>{@link com.buildsentinel.core.error.NotFoundException}: remove of an
 * unknown name</li>
 * </ul>
 *
 * <p>
 * Delivery and persistence failures have their own types in the
 * {@code delivery} and {@code state} packages; neither is ever fatal.
 * </p>
 *
 * @since 1.0.0
 */
package com.buildsentinel.core.error;
