package com.mike.contactharvester.service.emailextractor;

import com.mike.contactharvester.config.EmailExtractorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.naming.NamingException;
import javax.naming.directory.Attribute;
import javax.naming.directory.Attributes;
import javax.naming.directory.DirContext;
import javax.naming.directory.InitialDirContext;
import java.util.Hashtable;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
@Slf4j
public class JndiDnsMxLookup implements MxLookUp {

    private final long mxTimeoutMs;

    // one lookup per domain and run, sessions share the answer
    private final Map<String, MxStatus> cache = new ConcurrentHashMap<>();

    public JndiDnsMxLookup(EmailExtractorProperties props) {
        this.mxTimeoutMs = props.mxTimeoutMs();
    }

    @Override
    public MxStatus checkDomain(String domain) {
        return cache.computeIfAbsent(domain, this::lookup);
    }

    private MxStatus lookup(String domain) {
        Hashtable<String, String> env = new Hashtable<>();
        env.put("java.naming.factory.initial", "com.sun.jndi.dns.DnsContextFactory");
        env.put("com.sun.jndi.dns.timeout.initial", String.valueOf(mxTimeoutMs));
        env.put("com.sun.jndi.dns.timeout.retries", "1");

        DirContext ctx = null;
        try {
            ctx = new InitialDirContext(env);
            Attributes attrs = ctx.getAttributes(domain, new String[]{"MX"});
            Attribute attr = attrs.get("MX");

            return (attr != null && attr.size() > 0) ? MxStatus.VALID : MxStatus.INVALID;
        } catch (javax.naming.NameNotFoundException e) {
            return MxStatus.INVALID;
        } catch (NamingException e) {
            log.debug("JndiDnsMxLookup: lookup failed for domain={}: {}", domain, e.toString());
            return MxStatus.UNKNOWN;
        } finally {
            if (ctx != null) {
                try {
                    ctx.close();
                } catch (NamingException e) {
                    log.debug("JndiDnsMxLookup: failed to close DNS context: {}", e.toString());
                }
            }
        }
    }
}
