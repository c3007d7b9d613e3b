package com.mike.contactharvester.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class HarvestRunSummary {
    boolean cancelled;

    int queriesRun;
    int providerErrors;
    int seedUrls;

    int sessionsCompleted;
    int sessionsFailed;
    int pagesFetched;

    int candidatesFound;
    int emailsAccepted;
    int emailsUnique;

    public String toLogLine() {
        return "cancelled=" + cancelled +
                " queriesRun=" + queriesRun +
                " providerErrors=" + providerErrors +
                " seedUrls=" + seedUrls +
                " sessionsCompleted=" + sessionsCompleted +
                " sessionsFailed=" + sessionsFailed +
                " pagesFetched=" + pagesFetched +
                " candidatesFound=" + candidatesFound +
                " emailsAccepted=" + emailsAccepted +
                " emailsUnique=" + emailsUnique;
    }
}
