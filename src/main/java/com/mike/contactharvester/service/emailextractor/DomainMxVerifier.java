package com.mike.contactharvester.service.emailextractor;

import com.mike.contactharvester.config.EmailExtractorProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class DomainMxVerifier {

    private final MxLookUp mxLookUp;
    private final EmailExtractorProperties props;

    public boolean isDomainAllowed(String email) {

        if (!props.mxCheckEnabled()) return true;

        String domain = email.substring(email.indexOf('@') + 1);
        MxLookUp.MxStatus mx = mxLookUp.checkDomain(domain);

        if (mx == MxLookUp.MxStatus.INVALID) {
            log.debug("DomainMxVerifier: no MX record for domain={}, dropping {}", domain, email);
            return false;
        }

        if (mx == MxLookUp.MxStatus.UNKNOWN) {
            if (props.mxUnknownPolicy() == EmailExtractorProperties.MxUnknownPolicy.DROP) return false;
            log.warn("DomainMxVerifier: MX check UNKNOWN for domain={}, email={}", domain, email);
        }
        return true;
    }
}
