package com.leadranker.ranking.csv;

/** One parsed lead import row; optional columns are null when blank. */
public record LeadRow(String accountName, String firstName, String lastName, String jobTitle,
                      String accountDomain, String employeeRange, String industry) {}
