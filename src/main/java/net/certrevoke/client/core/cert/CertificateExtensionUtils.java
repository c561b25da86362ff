package net.certrevoke.client.core.cert;

import java.io.IOException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.List;
import net.certrevoke.client.log.RevokeLogger;
import net.certrevoke.client.log.RevokeLoggerFactory;
import org.bouncycastle.asn1.ASN1IA5String;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.ASN1OctetString;
import org.bouncycastle.asn1.ASN1Primitive;
import org.bouncycastle.asn1.x509.AccessDescription;
import org.bouncycastle.asn1.x509.AuthorityInformationAccess;
import org.bouncycastle.asn1.x509.CRLDistPoint;
import org.bouncycastle.asn1.x509.DistributionPoint;
import org.bouncycastle.asn1.x509.DistributionPointName;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;

class CertificateExtensionUtils {
  private static final RevokeLogger logger =
      RevokeLoggerFactory.getLogger(CertificateExtensionUtils.class);

  private CertificateExtensionUtils() {}

  /**
   * Every URI general name of every full-name distribution point, in declaration order. Non-HTTP
   * schemes such as ldap are kept; deciding what to do with them is up to the caller.
   */
  static List<String> extractCRLDistributionPoints(X509Certificate cert) {
    List<String> crlUrls = new ArrayList<>();

    try {
      ASN1Primitive extension = getExtension(cert, Extension.cRLDistributionPoints);
      if (extension == null) {
        logger.debug(
            "No CRL Distribution Points extension found for certificate: {}",
            cert.getSubjectX500Principal());
        return crlUrls;
      }

      DistributionPoint[] distributionPoints =
          CRLDistPoint.getInstance(extension).getDistributionPoints();
      if (distributionPoints != null) {
        for (DistributionPoint dp : distributionPoints) {
          DistributionPointName dpName = dp.getDistributionPoint();
          if (dpName != null && dpName.getType() == DistributionPointName.FULL_NAME) {
            GeneralNames generalNames = GeneralNames.getInstance(dpName.getName());
            for (GeneralName generalName : generalNames.getNames()) {
              if (generalName.getTagNo() == GeneralName.uniformResourceIdentifier) {
                String url = ASN1IA5String.getInstance(generalName.getName()).getString();
                logger.debug("Found CRL URL: {}", url);
                crlUrls.add(url);
              }
            }
          }
        }
      }
    } catch (Exception e) {
      logger.debug(
          "Failed to extract CRL distribution points from certificate {}: {}",
          cert.getSubjectX500Principal(),
          e.getMessage());
    }

    return crlUrls;
  }

  static List<String> extractOcspUrls(X509Certificate cert) {
    return extractAuthorityInformationAccess(cert, AccessDescription.id_ad_ocsp);
  }

  static List<String> extractIssuingCertificateUrls(X509Certificate cert) {
    return extractAuthorityInformationAccess(cert, AccessDescription.id_ad_caIssuers);
  }

  private static List<String> extractAuthorityInformationAccess(
      X509Certificate cert, ASN1ObjectIdentifier accessMethod) {
    List<String> urls = new ArrayList<>();
    try {
      ASN1Primitive extension = getExtension(cert, Extension.authorityInfoAccess);
      if (extension == null) {
        return urls;
      }
      AuthorityInformationAccess aia = AuthorityInformationAccess.getInstance(extension);
      for (AccessDescription ad : aia.getAccessDescriptions()) {
        GeneralName location = ad.getAccessLocation();
        if (accessMethod.equals(ad.getAccessMethod())
            && location.getTagNo() == GeneralName.uniformResourceIdentifier) {
          urls.add(ASN1IA5String.getInstance(location.getName()).getString());
        }
      }
    } catch (Exception e) {
      logger.debug(
          "Failed to extract authority information access from certificate {}: {}",
          cert.getSubjectX500Principal(),
          e.getMessage());
    }
    return urls;
  }

  private static ASN1Primitive getExtension(X509Certificate cert, ASN1ObjectIdentifier oid)
      throws IOException {
    byte[] extensionBytes = cert.getExtensionValue(oid.getId());
    if (extensionBytes == null) {
      return null;
    }
    ASN1OctetString octetString = ASN1OctetString.getInstance(extensionBytes);
    return ASN1Primitive.fromByteArray(octetString.getOctets());
  }
}
