package com.phillippitts.mockinterview.domain;

/**
 * Role the candidate is practicing for. Only the title is required.
 *
 * @param title       job title
 * @param company     optional company name
 * @param description optional job description
 */
public record JobContext(String title, String company, String description) {

    public static JobContext of(String title) {
        return new JobContext(title, null, null);
    }
}
