package com.astrofiler.service;

import com.astrofiler.exception.FitsReadException;
import com.astrofiler.model.FitsHeader;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;
import nom.tam.util.BufferedFile;
import nom.tam.util.Cursor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads and rewrites primary FITS headers through nom.tam.fits.
 */
public class FitsHeaderService {
    private static final Logger LOG = LogManager.getLogger(FitsHeaderService.class);
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

    /** Reads the primary header. The file is closed before returning. */
    public FitsHeader readHeader(Path file) throws FitsReadException {
        try (Fits fits = new Fits(file.toFile())) {
            BasicHDU<?> hdu = fits.getHDU(0);
            if (hdu == null) {
                throw new FitsReadException("No primary HDU in " + file, null);
            }
            return toFitsHeader(hdu.getHeader());
        } catch (FitsException | IOException e) {
            throw new FitsReadException("Cannot read FITS header of " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Writes the modified cards of {@code header} into the primary HDU. The new file is
     * written next to the original and moved over it, so a failure leaves the original intact.
     */
    public void writeHeader(Path file, FitsHeader header) throws IOException {
        if (!header.isModified()) return;
        int changed = header.modifiedKeys().size();
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.deleteIfExists(tmp);
        try (Fits fits = new Fits(file.toFile())) {
            fits.read();
            Header target = fits.getHDU(0).getHeader();
            for (String key : header.modifiedKeys()) {
                applyCard(target, key, header.getRaw(key));
            }
            try (BufferedFile out = new BufferedFile(tmp.toFile(), "rw")) {
                fits.write(out);
            }
        } catch (FitsException e) {
            Files.deleteIfExists(tmp);
            throw new IOException("Cannot rewrite FITS header of " + file + ": " + e.getMessage(), e);
        } catch (IOException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        header.markClean();
        LOG.debug("Rewrote {} header cards in {}", changed, file);
    }

    /** Primary image data as returned by nom.tam (e.g. {@code short[][]}, {@code float[][]}). */
    public Object readImageData(Path file) throws FitsReadException {
        try (Fits fits = new Fits(file.toFile())) {
            BasicHDU<?> hdu = fits.getHDU(0);
            if (hdu == null) {
                throw new FitsReadException("No primary HDU in " + file, null);
            }
            return hdu.getKernel();
        } catch (FitsException | IOException e) {
            throw new FitsReadException("Cannot read image data of " + file + ": " + e.getMessage(), e);
        }
    }

    static FitsHeader toFitsHeader(Header header) {
        Map<String, Object> values = new LinkedHashMap<>();
        Cursor<String, HeaderCard> it = header.iterator();
        while (it.hasNext()) {
            HeaderCard card = it.next();
            if (!card.isKeyValuePair()) continue;
            String raw = card.getValue();
            if (raw == null) continue;
            values.put(card.getKey(), card.isStringValue() ? raw : parseValue(raw.trim()));
        }
        return new FitsHeader(values);
    }

    private static Object parseValue(String raw) {
        if ("T".equals(raw)) return Boolean.TRUE;
        if ("F".equals(raw)) return Boolean.FALSE;
        try {
            if (INTEGER.matcher(raw).matches() && raw.length() < 19) {
                return Long.parseLong(raw);
            }
            return Double.parseDouble(raw.replace('D', 'E').replace('d', 'e'));
        } catch (NumberFormatException e) {
            return raw;
        }
    }

    private static void applyCard(Header target, String key, Object value) throws FitsException {
        if (value == null) {
            target.deleteKey(key);
        } else if (value instanceof Boolean) {
            target.addValue(key, (Boolean) value, null);
        } else if (value instanceof Long) {
            target.addValue(key, (Long) value, null);
        } else if (value instanceof Double) {
            target.addValue(key, (Double) value, null);
        } else {
            target.addValue(key, value.toString(), null);
        }
    }
}
