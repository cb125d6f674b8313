package com.justtrades.api.dto.request;

import com.justtrades.domain.enums.ExitReason;
import lombok.Data;

/** Body of a manual exit. An absent reason is recorded as MANUAL. */
@Data
public class ExitRequest {

    private ExitReason reason;
}
