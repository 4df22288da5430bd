package net.eventposters.controller.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import net.eventposters.domain.poster.EventRecord;

/**
 * Event details submitted by the poster form.
 *
 * @param time display time
 * @param date display date
 * @param title multi-line event title; line breaks are kept as title lines
 * @param venue venue name
 * @param address venue address
 * @param backgroundQuery optional background keywords
 * @param page optional search-result page, defaults to 1
 */
public record EventPosterRequest(
    @NotBlank @Size(max = 40) String time,
    @NotBlank @Size(max = 40) String date,
    @NotBlank @Size(max = 400) String title,
    @NotBlank @Size(max = 120) String venue,
    @Size(max = 200) String address,
    @Size(max = 100) String backgroundQuery,
    @Min(1) @Max(1000) Integer page
) {

    public EventRecord toEventRecord() {
        return EventRecord.fromRawTitle(time, date, title, venue, address, backgroundQuery, page == null ? 1 : page);
    }
}
