package com.pennywise.dto;

/**
 * Validation group for fields required on create but optional on update
 * (updates keep the stored value for omitted fields).
 */
public interface OnCreate {
}
