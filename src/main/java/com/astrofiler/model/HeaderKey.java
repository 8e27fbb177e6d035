package com.astrofiler.model;

/**
 * FITS header cards the pipeline reads or writes by name.
 * Anything else passes through {@link FitsHeader} untouched.
 */
public enum HeaderKey {
    IMAGETYP("IMAGETYP"),
    FRAME("FRAME"),
    OBJECT("OBJECT"),
    DATE_OBS("DATE-OBS"),
    DATE("DATE"),
    EXPTIME("EXPTIME"),
    EXPOSURE("EXPOSURE"),
    TELESCOP("TELESCOP"),
    INSTRUME("INSTRUME"),
    FILTER("FILTER"),
    XBINNING("XBINNING"),
    YBINNING("YBINNING"),
    CCD_TEMP("CCD-TEMP"),
    GAIN("GAIN"),
    OFFSET("OFFSET"),
    CDELT1("CDELT1"),
    CDELT2("CDELT2"),
    CROTA2("CROTA2"),
    CD1_1("CD1_1"),
    CD1_2("CD1_2"),
    CD2_1("CD2_1"),
    CD2_2("CD2_2"),
    NCOMBINE("NCOMBINE"),
    NIMAGES("NIMAGES"),
    MSTTYPE("MSTTYPE"),
    SESSID("SESSID"),
    CREATOR("CREATOR");

    private final String key;

    HeaderKey(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
