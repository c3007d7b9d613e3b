package com.mike.contactharvester.service.emailextractor;

public interface MxLookUp {

    enum MxStatus { VALID, INVALID, UNKNOWN }

    MxStatus checkDomain(String domain);
}
