/* (C)2026 */
package com.ammann.captionbox.model;

/**
 * Normal distribution parameters of one feature within one class.
 */
public record GaussianParams(double mean, double std) {}
