package ocsphealth.messages;

public class CensysCertificateFields {

    public static final String RAW = "raw";

    public static final String ISSUER_URLS = "parsed.extensions.authority_info_access.issuer_urls";

    public static final String OCSP_URLS = "parsed.extensions.authority_info_access.ocsp_urls";

    public static final String AUTHORITY_KEY_ID = "parsed.extensions.authority_key_id";

    public static final String IS_CA = "parsed.extensions.basic_constraints.is_ca";

    public static final String ISSUER_ORGANIZATION = "parsed.issuer.organization";

    public static final String NSS_VALID = "validation.nss.valid";

    private CensysCertificateFields() {}
}
