package com.cloudsec.transformer.validation;

/** Severity of a template validation finding */
public enum ValidationSeverity {
  /** Template is invalid */
  ERROR,
  /** Advisory, template remains valid */
  WARNING,
  /** Informational */
  INFO
}
